package com.tapas.superstore.etl.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * Envelope of a Pub/Sub push delivery. {@code data} holds the base64 body.
 */
public record PubSubPushRequest(
        @NotNull @Valid Message message,
        String subscription) {

    public record Message(
            String data,
            String messageId,
            Map<String, String> attributes,
            String publishTime) {
    }
}
