package com.warehouse.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.postgresql.util.PGobject;

import java.math.BigDecimal;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdbcValuesTest {

    @Test
    void scalarsPassThrough() throws Exception {
        assertThat(JdbcValues.toJsonSafe(null)).isNull();
        assertThat(JdbcValues.toJsonSafe(42)).isEqualTo(42);
        assertThat(JdbcValues.toJsonSafe(new BigDecimal("1.50"))).isEqualTo(new BigDecimal("1.50"));
        assertThat(JdbcValues.toJsonSafe(true)).isEqualTo(true);
        assertThat(JdbcValues.toJsonSafe("north")).isEqualTo("north");
    }

    @Test
    void temporalUuidAndBinaryBecomeStrings() throws Exception {
        UUID id = UUID.fromString("7d444840-9dc0-11d1-b245-5ffdce74fad2");
        assertThat(JdbcValues.toJsonSafe(id)).isEqualTo(id.toString());
        assertThat(JdbcValues.toJsonSafe(LocalDate.of(2024, 2, 29))).isEqualTo("2024-02-29");
        assertThat(JdbcValues.toJsonSafe(Timestamp.valueOf("2024-01-02 03:04:05")))
                .isEqualTo("2024-01-02 03:04:05.0");
        assertThat(JdbcValues.toJsonSafe(new byte[]{1, 2, 3})).isEqualTo("AQID");
    }

    @Test
    void sqlArraysBecomeLists() throws Exception {
        Array array = mock(Array.class);
        when(array.getArray()).thenReturn(new Object[]{"a", 2, null});

        assertThat(JdbcValues.toJsonSafe(array)).isEqualTo(java.util.Arrays.asList("a", 2, null));
    }

    private static PGobject pgObject(String type, String value) throws SQLException {
        PGobject object = new PGobject();
        object.setType(type);
        object.setValue(value);
        return object;
    }

    @Test
    void jsonAndJsonbBecomeStructuredTrees() throws Exception {
        Object jsonb = JdbcValues.toJsonSafe(pgObject("jsonb", "{\"a\": 1, \"tags\": [\"x\", \"y\"]}"));
        Object json = JdbcValues.toJsonSafe(pgObject("json", "[1, 2, 3]"));

        assertThat(jsonb).isInstanceOf(JsonNode.class);
        JsonNode tree = (JsonNode) jsonb;
        assertThat(tree.isObject()).isTrue();
        assertThat(tree.path("a").asInt()).isEqualTo(1);
        assertThat(tree.path("tags").get(1).asText()).isEqualTo("y");
        assertThat(((JsonNode) json).isArray()).isTrue();
        assertThat(((JsonNode) json).size()).isEqualTo(3);
    }

    @Test
    void otherPgObjectsStayText() throws Exception {
        assertThat(JdbcValues.toJsonSafe(pgObject("inet", "10.0.0.1"))).isEqualTo("10.0.0.1");
        assertThat(JdbcValues.toJsonSafe(pgObject("jsonb", null))).isNull();
    }

    @Test
    void malformedJsonIsReportedAsSqlError() throws Exception {
        PGobject broken = pgObject("json", "{not json");

        assertThatThrownBy(() -> JdbcValues.toJsonSafe(broken)).isInstanceOf(SQLException.class);
    }

    @Test
    void readRowKeepsProjectionOrder() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(3);
        when(md.getColumnLabel(1)).thenReturn("id");
        when(md.getColumnLabel(2)).thenReturn("name");
        when(md.getColumnLabel(3)).thenReturn("district");
        when(rs.getObject(1)).thenReturn(7);
        when(rs.getObject(2)).thenReturn("Corner Shop");
        when(rs.getObject(3)).thenReturn(null);

        Map<String, Object> row = JdbcValues.readRow(rs);

        assertThat(row.keySet()).containsExactly("id", "name", "district");
        assertThat(row.values()).containsExactly(7, "Corner Shop", null);
    }
}
