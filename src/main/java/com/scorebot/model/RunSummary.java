package com.scorebot.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * End-of-run report for operators: fetch, scoring and persistence counters.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class RunSummary {
    public final LocalDate asOfDate;
    public final int universeSize;
    public final int workers;
    public final int succeeded;
    public final int noData;
    public final int errored;
    public final int scored;
    public final int compositeNull;
    public final int validationFailed;
    public final int persisted;
    public final int persistFailed;
    public final long elapsedMs;
    public final Map<String, String> failedSymbols;
    public final List<BatchRun> batches;

    public String toLogLine() {
        return String.format(
                Locale.US,
                "Run summary as_of=%s universe=%d workers=%d succeeded=%d no_data=%d errored=%d scored=%d "
                        + "composite_null=%d validation_failed=%d persisted=%d persist_failed=%d batches=%d elapsed=%.2fs",
                asOfDate,
                universeSize,
                workers,
                succeeded,
                noData,
                errored,
                scored,
                compositeNull,
                validationFailed,
                persisted,
                persistFailed,
                batches == null ? 0 : batches.size(),
                elapsedMs / 1000.0
        );
    }

    public JSONObject toJson() {
        JSONObject out = new JSONObject();
        out.put("event", "score_run_summary");
        out.put("as_of", asOfDate == null ? JSONObject.NULL : asOfDate.toString());
        out.put("universe", universeSize);
        out.put("workers", workers);
        out.put("succeeded", succeeded);
        out.put("no_data", noData);
        out.put("errored", errored);
        out.put("scored", scored);
        out.put("composite_null", compositeNull);
        out.put("validation_failed", validationFailed);
        out.put("persisted", persisted);
        out.put("persist_failed", persistFailed);
        out.put("elapsed_ms", elapsedMs);
        JSONObject failed = new JSONObject();
        if (failedSymbols != null) {
            for (Map.Entry<String, String> entry : failedSymbols.entrySet()) {
                failed.put(entry.getKey(), entry.getValue());
            }
        }
        out.put("failed_symbols", failed);
        JSONArray batchArray = new JSONArray();
        if (batches != null) {
            for (BatchRun batch : batches) {
                JSONObject b = new JSONObject();
                b.put("batch", batch.batchId);
                b.put("attempted", batch.attempted);
                b.put("succeeded", batch.succeeded);
                b.put("no_data", batch.noData);
                b.put("errored", batch.errored);
                b.put("transient_failures", batch.transientFailures);
                batchArray.put(b);
            }
        }
        out.put("batches", batchArray);
        return out;
    }
}
