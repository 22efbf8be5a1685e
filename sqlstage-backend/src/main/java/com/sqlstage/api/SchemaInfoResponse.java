package com.sqlstage.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaInfoResponse {
    private int schemaCount;
    private List<String> schemas;

    /** Keyed by schema name, in the order of {@link #schemas}. */
    private Map<String, SchemaDetail> details;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SchemaDetail {
        private long tableCount;
        private List<String> tables;

        /** Set when the table listing of this schema was itself staged. */
        private String tablesQueryId;
    }
}
