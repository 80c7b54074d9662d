package com.scorebot.runner;

import com.scorebot.model.BatchRun;
import com.scorebot.model.RawMetricBag;
import com.scorebot.model.Symbol;
import com.scorebot.model.SymbolOutcome;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Everything the fetch phase produced: bags for the symbols that succeeded, terminal failures
 * for the rest, and per-batch counters.
 */
public final class FetchPhaseResult {
    public final int workers;
    public final List<BatchRun> batches;
    private final Map<String, RawMetricBag> bags;
    private final Map<String, FetchAttempt> failures;
    public final int deferredRecovered;

    FetchPhaseResult(
            int workers,
            List<BatchRun> batches,
            Map<Symbol, RawMetricBag> bags,
            Map<Symbol, FetchAttempt> failures,
            int deferredRecovered
    ) {
        this.workers = workers;
        this.batches = List.copyOf(batches);
        TreeMap<String, RawMetricBag> sortedBags = new TreeMap<>();
        for (Map.Entry<Symbol, RawMetricBag> entry : bags.entrySet()) {
            sortedBags.put(entry.getKey().ticker(), entry.getValue());
        }
        TreeMap<String, FetchAttempt> sortedFailures = new TreeMap<>();
        for (Map.Entry<Symbol, FetchAttempt> entry : failures.entrySet()) {
            sortedFailures.put(entry.getKey().ticker(), entry.getValue());
        }
        this.bags = Collections.unmodifiableMap(sortedBags);
        this.failures = Collections.unmodifiableMap(sortedFailures);
        this.deferredRecovered = deferredRecovered;
    }

    /**
     * Fetched bags keyed by ticker, in ticker order.
     */
    public Map<String, RawMetricBag> bags() {
        return bags;
    }

    public Map<String, FetchAttempt> failures() {
        return failures;
    }

    public int count(SymbolOutcome outcome) {
        if (outcome == SymbolOutcome.SUCCEEDED) {
            return bags.size();
        }
        int n = 0;
        for (FetchAttempt attempt : failures.values()) {
            if (attempt.outcome() == outcome) {
                n++;
            }
        }
        return n;
    }

    public Map<String, String> failureReasons() {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, FetchAttempt> entry : failures.entrySet()) {
            out.put(entry.getKey(), entry.getValue().outcome().label() + " " + entry.getValue().reason());
        }
        return out;
    }
}
