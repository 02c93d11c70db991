package com.warehouse.util;

/**
 * Page and offset arithmetic shared by the query builder and the response assembly.
 */
public final class Pagination {
    public static final int MIN_PAGE_SIZE = 1;
    public static final int MAX_PAGE_SIZE = 1000;

    private Pagination() {
    }

    public static int clampPageSize(int pageSize) {
        return Math.max(MIN_PAGE_SIZE, Math.min(MAX_PAGE_SIZE, pageSize));
    }

    public static int clampPage(int page) {
        return Math.max(1, page);
    }

    /**
     * Zero-based row offset of the first row on {@code page}.
     *
     * @param page 1-based page number
     * @param pageSize rows per page
     * @return offset
     */
    public static long offset(int page, int pageSize) {
        return (long) (clampPage(page) - 1) * clampPageSize(pageSize);
    }

    /**
     * Number of pages needed for {@code totalItems}, rounding up. Zero items yields zero pages.
     *
     * @param totalItems total rows
     * @param pageSize rows per page
     * @return total pages
     */
    public static long totalPages(long totalItems, int pageSize) {
        int size = clampPageSize(pageSize);
        return (Math.max(0, totalItems) + size - 1) / size;
    }
}
