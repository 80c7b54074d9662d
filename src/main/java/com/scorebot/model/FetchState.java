package com.scorebot.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-symbol fetch lifecycle. SUCCESS and FAILED are terminal.
 */
public enum FetchState {
    PENDING,
    FETCHING,
    BACKOFF,
    SUCCESS,
    FAILED;

    public boolean terminal() {
        return this == SUCCESS || this == FAILED;
    }

    public boolean canMoveTo(FetchState next) {
        return allowedNext().contains(next);
    }

    private Set<FetchState> allowedNext() {
        switch (this) {
            case PENDING:
                return EnumSet.of(FETCHING);
            case FETCHING:
                return EnumSet.of(SUCCESS, BACKOFF, FAILED);
            case BACKOFF:
                return EnumSet.of(FETCHING, FAILED);
            default:
                return EnumSet.noneOf(FetchState.class);
        }
    }
}
