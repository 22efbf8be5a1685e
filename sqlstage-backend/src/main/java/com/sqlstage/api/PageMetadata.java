package com.sqlstage.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PageMetadata {
    private int totalRows;
    private int totalPages;
    private int pageSize;
    private long currentPage;
    private boolean hasNextPage;
    private boolean hasPreviousPage;
}
