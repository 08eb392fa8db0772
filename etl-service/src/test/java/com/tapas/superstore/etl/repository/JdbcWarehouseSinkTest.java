package com.tapas.superstore.etl.repository;

import com.tapas.superstore.etl.domain.TableColumn;
import com.tapas.superstore.etl.domain.WarehouseTable;
import com.tapas.superstore.etl.exception.SinkWriteException;
import com.tapas.superstore.etl.schema.FieldType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcWarehouseSinkTest {

    private static final List<TableColumn> ORDER_COLUMNS = List.of(
            TableColumn.of("Order ID", FieldType.STRING),
            TableColumn.of("Order Date", FieldType.DATE),
            TableColumn.of("Order_Item_Count", FieldType.INTEGER),
            TableColumn.of("Order_Mean_Profit", FieldType.DECIMAL));

    @TempDir
    Path tempDir;

    private SingleConnectionDataSource dataSource;
    private JdbcTemplate jdbcTemplate;
    private JdbcWarehouseSink sink;

    @BeforeEach
    void setUp() {
        dataSource = new SingleConnectionDataSource("jdbc:duckdb:" + tempDir.resolve("warehouse.duckdb"), true);
        jdbcTemplate = new JdbcTemplate(dataSource);
        sink = new JdbcWarehouseSink(jdbcTemplate, "Ecommerce_DW", true);
    }

    @AfterEach
    void tearDown() {
        dataSource.destroy();
    }

    private static Map<String, Object> order(String id, LocalDate date, Long count, String meanProfit) {
        var row = new LinkedHashMap<String, Object>();
        row.put("Order ID", id);
        row.put("Order Date", date);
        row.put("Order_Item_Count", count);
        row.put("Order_Mean_Profit", meanProfit == null ? null : new BigDecimal(meanProfit));
        return row;
    }

    private long count(String where) {
        return jdbcTemplate.queryForObject(
                "SELECT count(*) FROM \"Ecommerce_DW\".\"Orders\"" + where, Long.class);
    }

    @Test
    void createsTableAndAppendsRows() {
        sink.append(new WarehouseTable("Orders", ORDER_COLUMNS, List.of(
                order("O1", LocalDate.of(2024, 3, 15), 2L, "3.5"),
                order("O2", LocalDate.of(2016, 11, 8), 1L, "-1.25"))));

        assertEquals(2, count(""));
        assertEquals("2024-03-15", jdbcTemplate.queryForObject(
                "SELECT CAST(\"Order Date\" AS VARCHAR) FROM \"Ecommerce_DW\".\"Orders\" WHERE \"Order ID\" = 'O1'",
                String.class));
        assertEquals(0, new BigDecimal("-1.25").compareTo(jdbcTemplate.queryForObject(
                "SELECT \"Order_Mean_Profit\" FROM \"Ecommerce_DW\".\"Orders\" WHERE \"Order ID\" = 'O2'",
                BigDecimal.class)));
        assertEquals(2L, jdbcTemplate.queryForObject(
                "SELECT \"Order_Item_Count\" FROM \"Ecommerce_DW\".\"Orders\" WHERE \"Order ID\" = 'O1'",
                Long.class));
    }

    @Test
    void appendsAccumulateWithoutReplacing() {
        WarehouseTable batch = new WarehouseTable("Orders", ORDER_COLUMNS,
                List.of(order("O1", LocalDate.of(2024, 3, 15), 2L, "3.5")));

        sink.append(batch);
        sink.append(batch);

        assertEquals(2, count(" WHERE \"Order ID\" = 'O1'"));
    }

    @Test
    void writesNullFeatures() {
        sink.append(new WarehouseTable("Orders", ORDER_COLUMNS,
                List.of(order("O9", LocalDate.of(2024, 1, 1), null, null))));

        assertEquals(1, count(" WHERE \"Order_Item_Count\" IS NULL AND \"Order_Mean_Profit\" IS NULL"));
    }

    @Test
    void emptyTableIsSkipped() {
        sink.append(new WarehouseTable("Orders", ORDER_COLUMNS, List.of()));

        assertEquals(0, jdbcTemplate.queryForObject(
                "SELECT count(*) FROM information_schema.tables WHERE table_name = 'Orders'", Long.class));
    }

    @Test
    void rejectsInternalColumns() {
        var table = new WarehouseTable("OrderDetails",
                List.of(TableColumn.of("Order ID", FieldType.STRING), TableColumn.internal("OrderDetail ID")),
                List.of(Map.<String, Object>of("Order ID", "O1", "OrderDetail ID", "O1|P1")));

        assertThrows(IllegalArgumentException.class, () -> sink.append(table));
    }

    @Test
    void databaseErrorBecomesRetryableSinkFailure() {
        var withoutDdl = new JdbcWarehouseSink(jdbcTemplate, "Missing_DW", false);
        var table = new WarehouseTable("Orders", ORDER_COLUMNS,
                List.of(order("O1", LocalDate.of(2024, 3, 15), 2L, "3.5")));

        var ex = assertThrows(SinkWriteException.class, () -> withoutDdl.append(table));
        assertTrue(ex.isRetryable());
        assertTrue(ex.getMessage().contains("Missing_DW.Orders"));
    }
}
