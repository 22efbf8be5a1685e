package com.sqlstage.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sqlstage.model.FieldDescriptor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one statement: either the rows inline, or the id of a staged result whose rows are
 * fetched page by page.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecuteResponse {
    @JsonProperty("isLargeResult")
    private boolean largeResult;

    /** Set only for staged results. */
    private String queryId;

    private int rowCount;
    private List<FieldDescriptor> fields;

    /** Null for staged results. */
    private List<Map<String, Object>> rows;

    private Metadata metadata;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Metadata {
        private long rowsAffected;
        private long durationMs;
    }
}
