package com.tapas.superstore.etl.repository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.util.HashSet;
import java.util.Set;

/**
 * Keeps processed-message markers in the warehouse next to the data they guard.
 */
public class JdbcProcessedMessageStore implements ProcessedMessageStore {

    static final String TABLE = "etl_processed_messages";

    private static final Logger logger = LoggerFactory.getLogger(JdbcProcessedMessageStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final String dataset;
    private final boolean createTable;

    public JdbcProcessedMessageStore(JdbcTemplate jdbcTemplate, String dataset, boolean createTable) {
        this.jdbcTemplate = jdbcTemplate;
        this.dataset = dataset;
        this.createTable = createTable;
    }

    @Override
    public Set<String> findProcessedTables(String messageId) {
        ensureTable();
        String sql = "SELECT table_name FROM " + WarehouseNames.qualified(dataset, TABLE)
                + " WHERE message_id = ?";
        return new HashSet<>(jdbcTemplate.queryForList(sql, String.class, messageId));
    }

    @Override
    public void save(ProcessedMessage processedMessage) {
        ensureTable();
        String sql = "INSERT INTO " + WarehouseNames.qualified(dataset, TABLE)
                + " (message_id, table_name, processed_at) VALUES (?, ?, ?)";
        jdbcTemplate.update(sql,
                processedMessage.getMessageId(),
                processedMessage.getTableName(),
                Timestamp.from(processedMessage.getProcessedAt()));
        logger.debug("Marked {} of message {} as processed",
                processedMessage.getTableName(), processedMessage.getMessageId());
    }

    private void ensureTable() {
        if (!createTable) {
            return;
        }
        jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS " + WarehouseNames.quote(dataset));
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + WarehouseNames.qualified(dataset, TABLE) + """
                 (
                    message_id VARCHAR NOT NULL,
                    table_name VARCHAR NOT NULL,
                    processed_at TIMESTAMP NOT NULL
                )""");
    }
}
