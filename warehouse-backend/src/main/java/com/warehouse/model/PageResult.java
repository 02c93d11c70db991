package com.warehouse.model;

import java.util.List;
import java.util.Map;

/**
 * One page of rows plus the unpaged row count for the same filter.
 *
 * @param rows rows in pagination-column order, each keyed by column name in projection order
 * @param totalCount total rows matching the filter
 */
public record PageResult(List<Map<String, Object>> rows, long totalCount) {
}
