package com.tapas.superstore.etl.service;

import java.util.List;
import java.util.Map;

/**
 * One decoded input unit. The message id identifies the unit across
 * redeliveries.
 */
public record EtlRequest(
        String messageId,
        List<Map<String, Object>> records) {
}
