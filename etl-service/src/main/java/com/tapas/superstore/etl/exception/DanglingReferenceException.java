package com.tapas.superstore.etl.exception;

import java.util.Collection;

/**
 * Child rows reference parent keys that are not present in the batch.
 * Only raised when referential integrity is enforced strictly.
 */
public class DanglingReferenceException extends EtlException {

    public DanglingReferenceException(String parent, String child, Collection<?> missingKeys) {
        super(String.format("%s references %d missing %s key(s): %s",
                child, missingKeys.size(), parent, missingKeys));
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
