package com.scorebot.model;

/**
 * Fetch failure classes. Only TRANSIENT failures are retried within a run.
 */
public enum FailureKind {
    TRANSIENT("transient"),
    PERMANENT("permanent");

    private final String label;

    FailureKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean retryable() {
        return this == TRANSIENT;
    }
}
