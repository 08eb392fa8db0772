package com.tapas.superstore.etl.config;

import org.duckdb.DuckDBDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SimpleDriverDataSource;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Embedded DuckDB file as the columnar warehouse, for local runs and tests.
 * Connections are opened per request; DuckDB is single-writer and callers use
 * one connection at a time.
 */
@Configuration
@ConditionalOnProperty(name = "warehouse.type", havingValue = "duckdb", matchIfMissing = true)
public class DuckDBConfig {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBConfig.class);

    @Value("${duckdb.path:./data/warehouse.duckdb}")
    private String duckdbPath;

    @Bean(name = "warehouseDataSource")
    public DataSource warehouseDataSource() {
        logger.info("Initializing DuckDB warehouse with path: {}", duckdbPath);
        return new SimpleDriverDataSource(new DuckDBDriver(), "jdbc:duckdb:" + duckdbPath);
    }

    @Bean(name = "warehouseJdbcTemplate")
    public JdbcTemplate warehouseJdbcTemplate(@Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new JdbcTemplate(warehouseDataSource);
    }

    @Bean(name = "warehouseTransactionManager")
    public DataSourceTransactionManager warehouseTransactionManager(
            @Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new DataSourceTransactionManager(warehouseDataSource);
    }

    @Bean(name = "warehouseTransactions")
    public TransactionOperations warehouseTransactions(
            @Qualifier("warehouseTransactionManager") DataSourceTransactionManager warehouseTransactionManager) {
        return new TransactionTemplate(warehouseTransactionManager);
    }
}
