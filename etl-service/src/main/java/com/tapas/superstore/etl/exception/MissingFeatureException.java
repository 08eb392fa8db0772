package com.tapas.superstore.etl.exception;

import java.util.List;

/**
 * A selected feature was not produced by the derivation engine, which points at
 * a relationship or schema misconfiguration.
 */
public class MissingFeatureException extends EtlException {

    private final List<String> missingFeatures;

    public MissingFeatureException(List<String> missingFeatures) {
        super("Derived feature matrix is missing " + missingFeatures);
        this.missingFeatures = List.copyOf(missingFeatures);
    }

    public List<String> getMissingFeatures() {
        return missingFeatures;
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
