package com.warehouse.service;

import java.util.List;

/**
 * The paired data and count statements for one page request, with their bind values in order.
 *
 * @param dataSql paged SELECT
 * @param dataParams bind values for {@code dataSql}
 * @param countSql COUNT(*) over the same FROM/WHERE
 * @param countParams bind values for {@code countSql}
 */
public record TableQuery(String dataSql, List<Object> dataParams, String countSql, List<Object> countParams) {
}
