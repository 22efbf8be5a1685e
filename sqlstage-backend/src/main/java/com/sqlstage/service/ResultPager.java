package com.sqlstage.service;

import com.sqlstage.api.PageMetadata;
import com.sqlstage.api.PageResponse;
import com.sqlstage.model.StagedResultSet;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Serves fixed-size pages of a staged result.
 *
 * <p>Pages are cut from the snapshot taken at execution time and never re-query the database, so
 * all pages of one result agree with each other even if the underlying tables change.
 */
@Service
public class ResultPager {

    public static final int PAGE_SIZE = 100;

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private final StagedResultStore stagedResultStore;

    public ResultPager(StagedResultStore stagedResultStore) {
        this.stagedResultStore = stagedResultStore;
    }

    /**
     * Return one page of a staged result.
     *
     * @param queryId staged result id
     * @param pageIndex zero-based page index
     * @return the row slice with fields and pagination metadata; empty past the last page
     * @throws InvalidPageIndexException if {@code pageIndex} is negative
     * @throws ResultNotFoundException if the result is unknown or expired
     */
    public PageResponse getPage(String queryId, long pageIndex) {
        if (pageIndex < 0) {
            throw new InvalidPageIndexException(String.valueOf(pageIndex));
        }

        StagedResultSet staged = stagedResultStore.load(queryId);
        List<Map<String, Object>> rows = staged.getRows();
        int totalRows = rows.size();
        int totalPages = (totalRows + PAGE_SIZE - 1) / PAGE_SIZE;

        // Compared before multiplying so huge indexes cannot overflow the offset
        boolean pastEnd = pageIndex >= totalPages;
        List<Map<String, Object>> slice = List.of();
        boolean hasNextPage = false;
        if (!pastEnd) {
            int start = (int) pageIndex * PAGE_SIZE;
            int end = Math.min(start + PAGE_SIZE, totalRows);
            slice = rows.subList(start, end);
            hasNextPage = end < totalRows;
        }

        PageMetadata metadata = PageMetadata.builder()
                .totalRows(totalRows)
                .totalPages(totalPages)
                .pageSize(PAGE_SIZE)
                .currentPage(pageIndex)
                .hasNextPage(hasNextPage)
                .hasPreviousPage(pageIndex > 0)
                .build();

        return PageResponse.builder()
                .results(slice)
                .fields(staged.getFields())
                .metadata(metadata)
                .build();
    }

    /**
     * Parse a page index from request input. Any run of decimal digits is a valid index; values
     * beyond {@code Long.MAX_VALUE} are clamped to it and simply land past the last page.
     *
     * @throws InvalidPageIndexException unless {@code raw} is a non-negative integer
     */
    public static long parsePageIndex(String raw) {
        if (raw == null) {
            throw new InvalidPageIndexException(null);
        }
        String digits = raw.trim();
        if (!DIGITS.matcher(digits).matches()) {
            throw new InvalidPageIndexException(raw);
        }
        try {
            return Long.parseLong(digits);
        } catch (NumberFormatException e) {
            return Long.MAX_VALUE;
        }
    }
}
