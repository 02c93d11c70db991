package com.warehouse.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PaginationTest {

    @Test
    void totalPagesRoundsUpForEveryPageSize() {
        for (int pageSize = 1; pageSize <= 1000; pageSize += 37) {
            for (long totalItems : new long[]{0, 1, 99, 100, 101, 250, 1000, 12_345}) {
                long expected = (long) Math.ceil((double) totalItems / pageSize);
                assertThat(Pagination.totalPages(totalItems, pageSize))
                        .as("items=%d size=%d", totalItems, pageSize)
                        .isEqualTo(expected);
            }
        }
    }

    @Test
    void offsetIsPreviousPagesTimesPageSize() {
        assertThat(Pagination.offset(1, 100)).isZero();
        assertThat(Pagination.offset(3, 100)).isEqualTo(200);
        assertThat(Pagination.offset(7, 25)).isEqualTo(150);
    }

    @Test
    void offsetDoesNotOverflowIntForLargePages() {
        assertThat(Pagination.offset(Integer.MAX_VALUE, 1000))
                .isEqualTo((long) (Integer.MAX_VALUE - 1) * 1000);
    }

    @Test
    void outOfRangeInputsAreClamped() {
        assertThat(Pagination.clampPageSize(0)).isEqualTo(1);
        assertThat(Pagination.clampPageSize(-5)).isEqualTo(1);
        assertThat(Pagination.clampPageSize(5000)).isEqualTo(1000);
        assertThat(Pagination.clampPage(0)).isEqualTo(1);
        assertThat(Pagination.offset(0, 50)).isZero();
    }

    @Test
    void zeroItemsMeansZeroPages() {
        assertThat(Pagination.totalPages(0, 100)).isZero();
    }
}
