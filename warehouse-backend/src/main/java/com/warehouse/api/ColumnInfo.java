package com.warehouse.api;

import com.warehouse.model.ColumnDescriptor;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ColumnInfo {
    private String name;
    private String type;
    private boolean nullable;

    public static ColumnInfo from(ColumnDescriptor column) {
        return ColumnInfo.builder()
                .name(column.name())
                .type(column.sqlType())
                .nullable(column.nullable())
                .build();
    }
}
