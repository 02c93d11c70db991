package com.warehouse.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PaginationMetadata {
    @JsonProperty("total_items")
    private long totalItems;

    private int page;

    @JsonProperty("page_size")
    private int pageSize;

    @JsonProperty("total_pages")
    private long totalPages;
}
