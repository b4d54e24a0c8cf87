package com.tracebridge.collection.core.exporter;

public enum ExportResult {
    SUCCESS,
    /** Backend unavailable or overloaded; the same span may be offered again. */
    RETRYABLE_FAILURE;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
