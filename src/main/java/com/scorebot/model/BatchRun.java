package com.scorebot.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bookkeeping for one fetch batch. Lives only for the duration of a run.
 */
public final class BatchRun {
    public final int batchId;
    public final int attempted;
    public final int succeeded;
    public final int noData;
    public final int errored;
    public final int transientFailures;
    public final Map<String, String> errorReasons;
    public final long elapsedMs;

    public BatchRun(
            int batchId,
            int attempted,
            int succeeded,
            int noData,
            int errored,
            int transientFailures,
            Map<String, String> errorReasons,
            long elapsedMs
    ) {
        this.batchId = batchId;
        this.attempted = Math.max(0, attempted);
        this.succeeded = Math.max(0, succeeded);
        this.noData = Math.max(0, noData);
        this.errored = Math.max(0, errored);
        this.transientFailures = Math.max(0, transientFailures);
        this.errorReasons = errorReasons == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(errorReasons));
        this.elapsedMs = Math.max(0L, elapsedMs);
    }

    /**
     * Share of attempted symbols that ended on a service error: exhausted transient retries
     * plus crashed workers. Permanent no-data answers are not counted, slowing down would not
     * change them.
     */
    public double errorRate() {
        if (attempted <= 0) {
            return 0.0;
        }
        return (transientFailures + errored) / (double) attempted;
    }

    @Override
    public String toString() {
        return "BatchRun{batch=" + batchId
                + ", attempted=" + attempted
                + ", succeeded=" + succeeded
                + ", no_data=" + noData
                + ", errored=" + errored
                + ", transient_failures=" + transientFailures
                + ", elapsed_ms=" + elapsedMs
                + "}";
    }
}
