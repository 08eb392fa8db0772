package com.tapas.superstore.etl.config;

import com.clickhouse.jdbc.ClickHouseDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionOperations;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Properties;

/**
 * ClickHouse as the columnar warehouse. The dataset maps to a ClickHouse
 * database whose tables are provisioned outside this service.
 * <p>
 * ClickHouse has no multi-statement transactions, so a table append and its
 * processed-message marker are written one after the other.
 */
@Configuration
@ConditionalOnProperty(name = "warehouse.type", havingValue = "clickhouse")
public class ClickHouseConfig {

    private static final Logger log = LoggerFactory.getLogger(ClickHouseConfig.class);

    @Value("${clickhouse.host:clickhouse}")
    private String host;

    @Value("${clickhouse.port:8123}")
    private int port;

    @Value("${clickhouse.database:default}")
    private String database;

    @Value("${clickhouse.socket-timeout-ms:300000}")
    private int socketTimeoutMs;

    @Bean(name = "warehouseDataSource")
    public DataSource warehouseDataSource() throws SQLException {
        String url = String.format("jdbc:clickhouse://%s:%d/%s", host, port, database);
        log.info("Creating ClickHouse warehouse DataSource with URL: {}", url);
        Properties properties = new Properties();
        properties.setProperty("socket_timeout", String.valueOf(socketTimeoutMs));
        properties.setProperty("compress", "true");
        return new ClickHouseDataSource(url, properties);
    }

    @Bean(name = "warehouseJdbcTemplate")
    public JdbcTemplate warehouseJdbcTemplate(@Qualifier("warehouseDataSource") DataSource warehouseDataSource) {
        return new JdbcTemplate(warehouseDataSource);
    }

    @Bean(name = "warehouseTransactions")
    public TransactionOperations warehouseTransactions() {
        log.warn("ClickHouse has no transactions; a failure between an append and its marker can duplicate that table on redelivery");
        return TransactionOperations.withoutTransaction();
    }
}
