package com.scorebot.data;

import com.scorebot.model.FailureKind;

/**
 * A failed provider call, classified as retryable or not.
 */
public class FetchException extends Exception {
    private final FailureKind kind;
    private final String category;

    public FetchException(FailureKind kind, String category, String message) {
        this(kind, category, message, null);
    }

    public FetchException(FailureKind kind, String category, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind == null ? FailureKind.PERMANENT : kind;
        this.category = category == null || category.trim().isEmpty() ? "other" : category.trim();
    }

    public static FetchException transientFailure(String category, String message) {
        return new FetchException(FailureKind.TRANSIENT, category, message);
    }

    public static FetchException permanent(String category, String message) {
        return new FetchException(FailureKind.PERMANENT, category, message);
    }

    public FailureKind kind() {
        return kind;
    }

    /**
     * Short machine label such as timeout, rate_limit, http_5xx, http_4xx, parse_error or no_data.
     */
    public String category() {
        return category;
    }

    /**
     * 429 and 5xx are worth retrying; every other non-2xx status is not.
     */
    public static FetchException forHttpStatus(int status, String ticker) {
        String message = "http status=" + status + " ticker=" + ticker;
        if (status == 429) {
            return new FetchException(FailureKind.TRANSIENT, "rate_limit", message);
        }
        if (status >= 500 && status <= 599) {
            return new FetchException(FailureKind.TRANSIENT, "http_5xx", message);
        }
        if (status == 404) {
            return new FetchException(FailureKind.PERMANENT, "no_data", message);
        }
        return new FetchException(FailureKind.PERMANENT, "http_4xx", message);
    }
}
