package com.tapas.superstore.etl.dto;

import com.tapas.superstore.etl.service.EtlOutcome;

public record PushResponse(
        String messageId,
        String status,
        String reason) {

    public static PushResponse from(EtlOutcome outcome) {
        return new PushResponse(
                outcome.messageId(),
                outcome.status().name(),
                outcome.reason()
        );
    }
}
