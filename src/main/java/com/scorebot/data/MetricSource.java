package com.scorebot.data;

import com.scorebot.model.RawMetricBag;
import com.scorebot.model.Symbol;

/**
 * Provider boundary: given a symbol, return its raw metrics or fail.
 * Implementations may block on I/O and must be safe to call from several threads.
 */
@FunctionalInterface
public interface MetricSource {
    RawMetricBag fetch(Symbol symbol) throws FetchException, InterruptedException;
}
