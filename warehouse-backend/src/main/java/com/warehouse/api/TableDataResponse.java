package com.warehouse.api;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Body of {@code GET /api/data}: one page of rows, the table's column metadata and paging info.
 */
@Data
@Builder
public class TableDataResponse {
    private List<Map<String, Object>> data;
    private List<ColumnInfo> columns;
    private PaginationMetadata pagination;
}
