package com.tapas.superstore.etl.repository;

import com.tapas.superstore.etl.domain.TableColumn;
import com.tapas.superstore.etl.domain.WarehouseTable;
import com.tapas.superstore.etl.exception.SinkWriteException;
import com.tapas.superstore.etl.schema.FieldType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Appends warehouse tables with batched JDBC inserts into
 * {@code <dataset>.<table>}.
 * <p>
 * With {@code createTables} the dataset and table are created if absent before
 * every append, from the table's own column layout (DuckDB). Nothing is cached,
 * so DDL rolled back with a failed append is simply issued again. ClickHouse tables are provisioned
 * up front because they need an engine clause.
 */
public class JdbcWarehouseSink implements WarehouseSink {

    private static final Logger logger = LoggerFactory.getLogger(JdbcWarehouseSink.class);

    private final JdbcTemplate jdbcTemplate;
    private final String dataset;
    private final boolean createTables;

    public JdbcWarehouseSink(JdbcTemplate jdbcTemplate, String dataset, boolean createTables) {
        this.jdbcTemplate = jdbcTemplate;
        this.dataset = dataset;
        this.createTables = createTables;
    }

    @Override
    public void append(WarehouseTable table) {
        if (table.hasInternalColumns()) {
            throw new IllegalArgumentException("Table " + table.name() + " still carries internal columns");
        }
        String tableId = dataset + "." + table.name();
        if (table.rows().isEmpty()) {
            logger.debug("Nothing to append to {}", tableId);
            return;
        }

        List<TableColumn> columns = table.columns();
        String sql = "INSERT INTO " + WarehouseNames.qualified(dataset, table.name())
                + " (" + columns.stream().map(c -> WarehouseNames.quote(c.name())).collect(Collectors.joining(", "))
                + ") VALUES (" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";

        try {
            if (createTables) {
                createIfAbsent(table);
            }
            jdbcTemplate.batchUpdate(sql, table.rows(), table.rows().size(),
                    (ps, row) -> bind(ps, columns, row));
        } catch (DataAccessException e) {
            throw new SinkWriteException(tableId, e);
        }
        logger.info("Data successfully appended to warehouse table {}: {} row(s)", tableId, table.rows().size());
    }

    private void createIfAbsent(WarehouseTable table) {
        jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS " + WarehouseNames.quote(dataset));
        String columnsDdl = table.columns().stream()
                .map(c -> WarehouseNames.quote(c.name()) + " " + sqlTypeName(c.type()))
                .collect(Collectors.joining(", "));
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS "
                + WarehouseNames.qualified(dataset, table.name()) + " (" + columnsDdl + ")");
        logger.debug("Ensured table {}.{} exists", dataset, table.name());
    }

    private static void bind(PreparedStatement ps, List<TableColumn> columns, Map<String, Object> row)
            throws SQLException {
        for (int i = 0; i < columns.size(); i++) {
            TableColumn column = columns.get(i);
            Object value = row.get(column.name());
            int position = i + 1;
            if (value == null) {
                ps.setNull(position, sqlType(column.type()));
            } else if (value instanceof LocalDate date) {
                // ISO text; both warehouses cast it to the DATE column
                ps.setString(position, date.toString());
            } else if (value instanceof BigDecimal decimal) {
                ps.setBigDecimal(position, decimal);
            } else if (value instanceof Long number) {
                ps.setLong(position, number);
            } else {
                ps.setString(position, value.toString());
            }
        }
    }

    private static int sqlType(FieldType type) {
        return switch (type) {
            case INTEGER -> Types.BIGINT;
            case DECIMAL -> Types.DECIMAL;
            case DATE -> Types.DATE;
            case STRING, KEY -> Types.VARCHAR;
        };
    }

    private static String sqlTypeName(FieldType type) {
        return switch (type) {
            case INTEGER -> "BIGINT";
            case DECIMAL -> "DECIMAL(38, 10)";
            case DATE -> "DATE";
            case STRING, KEY -> "VARCHAR";
        };
    }
}
