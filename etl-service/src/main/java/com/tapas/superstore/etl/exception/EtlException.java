package com.tapas.superstore.etl.exception;

/**
 * Base type for failures raised while turning a sales message into warehouse rows.
 * The retryable flag tells the inbound adapter whether a redelivery can succeed.
 */
public abstract class EtlException extends RuntimeException {

    protected EtlException(String message) {
        super(message);
    }

    protected EtlException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isRetryable();
}
