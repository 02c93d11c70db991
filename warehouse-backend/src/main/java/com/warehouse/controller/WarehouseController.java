package com.warehouse.controller;

import com.warehouse.api.HealthResponse;
import com.warehouse.api.TableDataResponse;
import com.warehouse.model.QueryRequest;
import com.warehouse.service.TableDataService;
import com.warehouse.util.Pagination;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class WarehouseController {

    private final TableDataService tableDataService;

    public WarehouseController(TableDataService tableDataService) {
        this.tableDataService = tableDataService;
    }

    /**
     * Read one page of a warehouse table.
     *
     * GET /api/data
     *
     * @param schemaName schema holding the table
     * @param tableName table to read
     * @param district optional district filter, only applied when the table has a district column
     * @param page 1-based page number
     * @param pageSize rows per page
     * @return rows, column metadata and pagination info
     */
    @GetMapping("/api/data")
    public ResponseEntity<TableDataResponse> getTableData(
            @RequestParam(name = "schema_name") String schemaName,
            @RequestParam(name = "table_name") String tableName,
            @RequestParam(name = "district", required = false) String district,
            @RequestParam(name = "page", defaultValue = "1")
            @Min(value = 1, message = "must be greater than or equal to 1") int page,
            @RequestParam(name = "page_size", defaultValue = "100")
            @Min(value = 1, message = "must be greater than or equal to 1")
            @Max(value = Pagination.MAX_PAGE_SIZE, message = "must be less than or equal to 1000") int pageSize) {
        QueryRequest request = QueryRequest.builder()
                .schemaName(schemaName)
                .tableName(tableName)
                .districtFilter(district)
                .page(page)
                .pageSize(pageSize)
                .build();
        return ResponseEntity.ok(tableDataService.handle(request));
    }

    /**
     * GET /health
     */
    @GetMapping("/health")
    public HealthResponse health() {
        return new HealthResponse("ok");
    }
}
