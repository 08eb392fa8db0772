package com.tapas.superstore.etl.service;

import java.util.Map;

/**
 * Result of one pipeline invocation, telling the inbound adapter whether to
 * acknowledge the message or have it redelivered.
 */
public record EtlOutcome(
        String messageId,
        Status status,
        Map<String, Integer> rowsAppended,
        String reason,
        Throwable failure) {

    public enum Status {
        /** Every table is in the warehouse. */
        SUCCEEDED,
        /** Every table had already been appended by an earlier delivery. */
        DUPLICATE,
        /** Poison message: retrying cannot help. */
        REJECTED,
        /** Transient failure: redeliver. */
        FAILED_RETRYABLE
    }

    public EtlOutcome {
        rowsAppended = rowsAppended == null ? Map.of() : Map.copyOf(rowsAppended);
    }

    public static EtlOutcome succeeded(String messageId, Map<String, Integer> rowsAppended) {
        return new EtlOutcome(messageId, Status.SUCCEEDED, rowsAppended, null, null);
    }

    public static EtlOutcome duplicate(String messageId) {
        return new EtlOutcome(messageId, Status.DUPLICATE, Map.of(), "already processed", null);
    }

    public static EtlOutcome rejected(String messageId, Throwable failure) {
        return new EtlOutcome(messageId, Status.REJECTED, Map.of(), failure.getMessage(), failure);
    }

    public static EtlOutcome retryable(String messageId, Map<String, Integer> rowsAppended, Throwable failure) {
        return new EtlOutcome(messageId, Status.FAILED_RETRYABLE, rowsAppended, failure.getMessage(), failure);
    }

    public boolean isAcknowledgeable() {
        return status != Status.FAILED_RETRYABLE;
    }
}
