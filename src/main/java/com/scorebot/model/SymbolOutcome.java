package com.scorebot.model;

/**
 * How a symbol ended in a run, as reported in batch progress and the run summary.
 */
public enum SymbolOutcome {
    SUCCEEDED("succeeded"),
    NO_DATA("no_data"),
    ERRORED("errored");

    private final String label;

    SymbolOutcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
