package com.tessera.handler.jdbc;

import com.tessera.domain.ResultTable;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.sql.Array;
import java.sql.Clob;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Time;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a JDBC result set into a {@link ResultTable}, keeping column order even
 * when no rows are returned.
 *
 * Timestamps become {@code LocalDateTime}, SQL dates {@code LocalDate}, SQL times
 * {@code LocalTime}, arrays Java lists and CLOBs strings.
 */
public class ResultTableExtractor implements ResultSetExtractor<ResultTable> {

    public static final ResultTableExtractor INSTANCE = new ResultTableExtractor();

    @Override
    public ResultTable extractData(ResultSet rs) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int columnCount = metaData.getColumnCount();
        List<String> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(metaData.getColumnLabel(i));
        }

        ResultTable table = new ResultTable(columns);
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(columns.get(i - 1), convert(rs.getObject(i)));
            }
            table.addRow(row);
        }
        return table;
    }

    private Object convert(Object value) throws SQLException {
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        } else if (value instanceof java.sql.Date) {
            return ((java.sql.Date) value).toLocalDate();
        } else if (value instanceof Time) {
            return ((Time) value).toLocalTime();
        } else if (value instanceof Array) {
            Object array = ((Array) value).getArray();
            if (array instanceof Object[]) {
                return Arrays.asList((Object[]) array);
            }
            return array;
        } else if (value instanceof Clob) {
            Clob clob = (Clob) value;
            return clob.getSubString(1, (int) clob.length());
        }
        return value;
    }
}
