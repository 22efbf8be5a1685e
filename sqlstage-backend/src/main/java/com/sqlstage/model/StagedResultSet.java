package com.sqlstage.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Cache representation of a large result: rows and fields are kept together so that every page
 * can report its column names.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StagedResultSet {
    private List<Map<String, Object>> rows;
    private List<FieldDescriptor> fields;

    public static StagedResultSet of(QueryResult result) {
        return new StagedResultSet(result.getRows(), result.getFields());
    }
}
