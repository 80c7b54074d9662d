package com.scorebot.scoring;

/**
 * A computed score is NaN, infinite or outside its range. Always a bug in the scoring math.
 */
public class ScoreValidationException extends RuntimeException {
    private final String symbol;

    public ScoreValidationException(String message) {
        this(null, message);
    }

    public ScoreValidationException(String symbol, String message) {
        super(symbol == null ? message : message + " symbol=" + symbol);
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
