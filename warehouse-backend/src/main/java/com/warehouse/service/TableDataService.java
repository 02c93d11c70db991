package com.warehouse.service;

import com.warehouse.api.ColumnInfo;
import com.warehouse.api.PaginationMetadata;
import com.warehouse.api.TableDataResponse;
import com.warehouse.model.ColumnDescriptor;
import com.warehouse.model.PageResult;
import com.warehouse.model.QueryRequest;
import com.warehouse.util.Pagination;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Orchestrates one {@code /api/data} request: existence check, column lookup, paged query and
 * response assembly. Stateless across requests.
 */
@Slf4j
@Service
public class TableDataService {

    private final SchemaIntrospector schemaIntrospector;
    private final TableQueryService tableQueryService;

    public TableDataService(SchemaIntrospector schemaIntrospector, TableQueryService tableQueryService) {
        this.schemaIntrospector = schemaIntrospector;
        this.tableQueryService = tableQueryService;
    }

    /**
     * Load one page of a table.
     *
     * @param request validated request
     * @return paged response
     * @throws TableNotFoundException if the table is missing or has no columns
     * @throws PaginationColumnException if the pagination column is missing from the table
     * @throws QueryExecutionException if any database call fails
     */
    public TableDataResponse handle(QueryRequest request) {
        String schemaName = request.getSchemaName();
        String tableName = request.getTableName();
        int page = Pagination.clampPage(request.getPage());
        int pageSize = Pagination.clampPageSize(request.getPageSize());

        log.info("Table data requested: table={}, page={}, page_size={}, district_filter={}",
                request.qualifiedName(), page, pageSize, request.getDistrictFilter() != null);

        if (!schemaIntrospector.tableExists(schemaName, tableName)) {
            throw TableNotFoundException.missingTable(schemaName, tableName);
        }

        List<ColumnDescriptor> columns = schemaIntrospector.getColumns(schemaName, tableName);
        if (columns.isEmpty()) {
            throw TableNotFoundException.noColumns(schemaName, tableName);
        }

        PageResult result = tableQueryService.buildAndRun(
                schemaName, tableName, columns, request.getDistrictFilter(), page, pageSize);

        return TableDataResponse.builder()
                .data(result.rows())
                .columns(columns.stream().map(ColumnInfo::from).toList())
                .pagination(PaginationMetadata.builder()
                        .totalItems(result.totalCount())
                        .page(page)
                        .pageSize(pageSize)
                        .totalPages(Pagination.totalPages(result.totalCount(), pageSize))
                        .build())
                .build();
    }
}
