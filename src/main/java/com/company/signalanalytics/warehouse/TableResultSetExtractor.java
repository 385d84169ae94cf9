package com.company.signalanalytics.warehouse;

import com.company.signalanalytics.domain.ColumnSpec;
import com.company.signalanalytics.domain.Table;
import com.company.signalanalytics.domain.enums.ColumnType;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.support.JdbcUtils;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a whole result set into a {@link Table}, taking column types and
 * nullability from the result set metadata.
 */
public class TableResultSetExtractor implements ResultSetExtractor<Table> {

    @Override
    public Table extractData(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        int count = meta.getColumnCount();

        List<ColumnSpec> columns = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            columns.add(new ColumnSpec(
                    JdbcUtils.lookupColumnName(meta, i),
                    toColumnType(meta.getColumnType(i), meta.getScale(i)),
                    meta.isNullable(i) != ResultSetMetaData.columnNoNulls));
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        while (rs.next()) {
            Map<String, Object> row = new LinkedHashMap<>(count * 2);
            for (int i = 1; i <= count; i++) {
                row.put(columns.get(i - 1).getName(), JdbcUtils.getResultSetValue(rs, i));
            }
            rows.add(row);
        }
        return new Table(columns, rows);
    }

    static ColumnType toColumnType(int sqlType, int scale) {
        switch (sqlType) {
            case Types.TINYINT:
            case Types.SMALLINT:
            case Types.INTEGER:
            case Types.BIGINT:
                return ColumnType.INTEGER;
            case Types.NUMERIC:
            case Types.DECIMAL:
                return scale == 0 ? ColumnType.INTEGER : ColumnType.DECIMAL;
            case Types.REAL:
            case Types.FLOAT:
            case Types.DOUBLE:
                return ColumnType.DECIMAL;
            case Types.BOOLEAN:
            case Types.BIT:
                return ColumnType.BOOLEAN;
            case Types.DATE:
                return ColumnType.DATE;
            case Types.TIME:
                return ColumnType.TIME;
            case Types.TIMESTAMP:
            case Types.TIMESTAMP_WITH_TIMEZONE:
                return ColumnType.TIMESTAMP;
            default:
                return ColumnType.STRING;
        }
    }
}
