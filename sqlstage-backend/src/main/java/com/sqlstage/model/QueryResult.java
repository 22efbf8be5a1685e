package com.sqlstage.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Rows and column descriptors of one statement execution.
 *
 * <p>Rows keep the column order of the result set. {@code rowsAffected} is only meaningful for
 * statements that produced no result set.
 */
@Data
@Builder
public class QueryResult {
    @Builder.Default
    private List<FieldDescriptor> fields = List.of();

    @Builder.Default
    private List<Map<String, Object>> rows = List.of();

    private long rowsAffected;
    private long durationMs;

    public int rowCount() {
        return rows.size();
    }
}
