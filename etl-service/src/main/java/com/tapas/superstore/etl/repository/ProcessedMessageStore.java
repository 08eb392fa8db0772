package com.tapas.superstore.etl.repository;

import java.util.Set;

public interface ProcessedMessageStore {

    /**
     * Tables already appended for {@code messageId}.
     */
    Set<String> findProcessedTables(String messageId);

    void save(ProcessedMessage processedMessage);
}
