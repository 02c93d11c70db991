package com.warehouse.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Caller-supplied parameters of a table page read. Range checks on {@code page} and
 * {@code pageSize} happen at the HTTP boundary.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {
    public static final int DEFAULT_PAGE_SIZE = 100;

    private String schemaName;
    private String tableName;
    private String districtFilter;

    @Builder.Default
    private int page = 1;

    @Builder.Default
    private int pageSize = DEFAULT_PAGE_SIZE;

    public String qualifiedName() {
        return schemaName + "." + tableName;
    }
}
