package com.tapas.superstore.etl.config;

import com.tapas.superstore.etl.repository.JdbcProcessedMessageStore;
import com.tapas.superstore.etl.repository.JdbcWarehouseSink;
import com.tapas.superstore.etl.repository.ProcessedMessageStore;
import com.tapas.superstore.etl.repository.WarehouseSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Sink and processed-message ledger on top of whichever warehouse
 * {@code warehouse.type} selects.
 */
@Configuration
public class WarehouseConfig {

    private static final Logger log = LoggerFactory.getLogger(WarehouseConfig.class);

    @Value("${warehouse.dataset:Ecommerce_DW}")
    private String dataset;

    @Value("${warehouse.type:duckdb}")
    private String warehouseType;

    @Value("${warehouse.initialize-schema:}")
    private String initializeSchema;

    @Bean
    public WarehouseSink warehouseSink(@Qualifier("warehouseJdbcTemplate") JdbcTemplate warehouseJdbcTemplate) {
        boolean createTables = initializeSchema(warehouseType, initializeSchema);
        log.info("Appending to {} warehouse dataset {} (initialize schema: {})", warehouseType, dataset, createTables);
        return new JdbcWarehouseSink(warehouseJdbcTemplate, dataset, createTables);
    }

    @Bean
    public ProcessedMessageStore processedMessageStore(
            @Qualifier("warehouseJdbcTemplate") JdbcTemplate warehouseJdbcTemplate) {
        return new JdbcProcessedMessageStore(warehouseJdbcTemplate, dataset,
                initializeSchema(warehouseType, initializeSchema));
    }

    /**
     * An explicit setting wins. Otherwise only DuckDB creates its own tables;
     * ClickHouse tables need an engine clause and are provisioned up front.
     */
    static boolean initializeSchema(String warehouseType, String configured) {
        if (configured != null && !configured.isBlank()) {
            return Boolean.parseBoolean(configured.trim());
        }
        return "duckdb".equalsIgnoreCase(warehouseType);
    }
}
