package com.fieldinsight.reporting.infrastructure.persistence;

import org.junit.jupiter.api.Test;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * JdbcReportDataStore 结果集映射测试
 */
class JdbcReportDataStoreTest {

    @Test
    void testLongDisplayNamesRestoredByPosition() throws SQLException {
        String longName = "Average Growth Index Across All Petri Observations For The Selected Program";
        assertTrue(longName.getBytes().length > 63);

        ResultSet rs = resultSet(List.of("c1", "c2"), new Object[][]{{"North", 4.5}, {"South", 2.0}});

        List<Map<String, Object>> rows = JdbcReportDataStore.resultSetToList(rs, List.of("Site", longName));

        assertEquals(2, rows.size());
        assertEquals("North", rows.get(0).get("Site"));
        assertEquals(4.5, rows.get(0).get(longName));
        assertEquals(2.0, rows.get(1).get(longName));
        assertFalse(rows.get(0).containsKey("c2"));
    }

    @Test
    void testDatabaseLabelsUsedWithoutDisplayNames() throws SQLException {
        ResultSet rs = resultSet(List.of("id", "name"), new Object[][]{{"p1", "Alpha"}});

        List<Map<String, Object>> rows = JdbcReportDataStore.resultSetToList(rs, List.of());

        assertEquals(Map.of("id", "p1", "name", "Alpha"), rows.get(0));
    }

    @Test
    void testColumnCountMismatchRejected() throws SQLException {
        ResultSet rs = resultSet(List.of("c1"), new Object[][]{});

        SQLException ex = assertThrows(SQLException.class,
                () -> JdbcReportDataStore.resultSetToList(rs, List.of("Site", "Total")));
        assertEquals("Expected 2 result columns, got 1", ex.getMessage());
    }

    private static ResultSet resultSet(List<String> columns, Object[][] data) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            when(md.getColumnLabel(i + 1)).thenReturn(columns.get(i));
        }
        int[] cursor = {-1};
        when(rs.next()).thenAnswer(inv -> ++cursor[0] < data.length);
        when(rs.getObject(anyInt()))
                .thenAnswer(inv -> data[cursor[0]][inv.<Integer>getArgument(0) - 1]);
        return rs;
    }
}
