package com.tapas.superstore.etl.exception;

/**
 * Input could not be decoded, or a record is missing a required field or
 * carries a value of the wrong type.
 */
public class MalformedRecordException extends EtlException {

    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
