package com.warehouse.model;

/**
 * Column metadata as reported by {@code information_schema.columns}.
 *
 * @param name column name
 * @param sqlType declared data type
 * @param nullable whether the column accepts NULL
 */
public record ColumnDescriptor(String name, String sqlType, boolean nullable) {
}
