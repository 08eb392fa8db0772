package com.tapas.superstore.etl.exception;

public class SinkWriteException extends EtlException {

    public SinkWriteException(String tableId, Throwable cause) {
        super("Failed to append rows to " + tableId, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
