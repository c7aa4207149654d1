package com.eainde.analysis.error;

/**
 * Classification of a fatal stage failure as recorded in the ledger.
 */
public enum ErrorKind {
    UPSTREAM_CAPABILITY(true),
    TIMEOUT(true),
    SCHEMA_VALIDATION(false),
    CALCULATION(false),
    CONSISTENCY_CONTRADICTION(false),
    FORMAT(false),
    INTERNAL(false);

    private final boolean transientFailure;

    ErrorKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Whether a fresh run for the same key may succeed where this one failed.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
