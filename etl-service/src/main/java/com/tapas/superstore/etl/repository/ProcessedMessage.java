package com.tapas.superstore.etl.repository;

import java.time.Instant;

/**
 * Marker that one table of one inbound message has been appended.
 * Lets a redelivered message skip the tables it already wrote.
 */
public class ProcessedMessage {

    private final String messageId;
    private final String tableName;
    private final Instant processedAt;

    public ProcessedMessage(String messageId, String tableName, Instant processedAt) {
        this.messageId = messageId;
        this.tableName = tableName;
        this.processedAt = processedAt;
    }

    public String getMessageId() {
        return messageId;
    }

    public String getTableName() {
        return tableName;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }
}
