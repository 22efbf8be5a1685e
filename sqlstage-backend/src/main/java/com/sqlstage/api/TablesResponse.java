package com.sqlstage.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Tables of the {@code public} schema. A listing above the staging threshold is reported by
 * {@code queryId} like any other large result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TablesResponse {
    private List<String> tables;

    @JsonProperty("isLargeResult")
    private boolean largeResult;

    private String queryId;
    private int tableCount;
}
