package com.sqlstage.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sqlstage.model.FieldDescriptor;
import com.sqlstage.model.StagedResultSet;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON encoding of {@link StagedResultSet} with schema validation on read.
 */
@Component
public class StagedResultCodec {

    private final ObjectMapper objectMapper;

    public StagedResultCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(StagedResultSet staged) {
        try {
            return objectMapper.writeValueAsString(staged);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize staged result", e);
        }
    }

    /**
     * Decode and validate a cache entry.
     *
     * @param json cached value
     * @return staged result
     * @throws StagedResultCorruptException if the value is not a well-formed staged result
     */
    public StagedResultSet decode(String json) {
        StagedResultSet staged;
        try {
            staged = objectMapper.readValue(json, StagedResultSet.class);
        } catch (JsonProcessingException e) {
            throw new StagedResultCorruptException("Staged result is not valid JSON: " + e.getOriginalMessage(), e);
        }
        validate(staged);
        return staged;
    }

    private void validate(StagedResultSet staged) {
        if (staged == null) {
            throw new StagedResultCorruptException("Staged result is empty");
        }
        List<FieldDescriptor> fields = staged.getFields();
        if (fields == null) {
            throw new StagedResultCorruptException("Staged result has no field descriptors");
        }
        if (staged.getRows() == null) {
            throw new StagedResultCorruptException("Staged result has no rows");
        }

        Set<String> names = new HashSet<>();
        for (FieldDescriptor field : fields) {
            if (field == null || field.getName() == null) {
                throw new StagedResultCorruptException("Staged result has an unnamed field");
            }
            names.add(field.getName());
        }

        for (Map<String, Object> row : staged.getRows()) {
            if (row == null) {
                throw new StagedResultCorruptException("Staged result contains a null row");
            }
            for (String column : row.keySet()) {
                if (!names.contains(column)) {
                    throw new StagedResultCorruptException("Staged row references undeclared column: " + column);
                }
            }
        }
    }
}
