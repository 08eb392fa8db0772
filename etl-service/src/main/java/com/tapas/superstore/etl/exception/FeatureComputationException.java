package com.tapas.superstore.etl.exception;

/**
 * A feature could not be computed from the batch, for example an integer sum
 * that does not fit in a long. The same batch fails the same way on every attempt.
 */
public class FeatureComputationException extends EtlException {

    public FeatureComputationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
