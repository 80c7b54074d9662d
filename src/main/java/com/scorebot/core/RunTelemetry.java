package com.scorebot.core;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Step timings and item counts for one scoring run.
 */
public final class RunTelemetry {
    public static final String STEP_FETCH = "FETCH";
    public static final String STEP_NORMALIZE = "NORMALIZE";
    public static final String STEP_SCORE = "SCORE";
    public static final String STEP_PERSIST = "PERSIST";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String runMode;
    private final LocalDate asOfDate;
    private final Instant startedAt;
    private Instant finishedAt;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Long> openSteps = new LinkedHashMap<>();

    public RunTelemetry(String runMode, LocalDate asOfDate, Instant startedAt) {
        String mode = runMode == null ? "" : runMode.trim();
        this.runMode = mode.isEmpty() ? "SCORE" : mode.toUpperCase(Locale.ROOT);
        this.asOfDate = asOfDate;
        this.startedAt = startedAt == null ? Instant.now() : startedAt;
    }

    public synchronized void startStep(String name) {
        String key = stepKey(name);
        steps.computeIfAbsent(key, StepStat::new);
        openSteps.put(key, System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        String key = stepKey(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        Long started = openSteps.remove(key);
        if (started != null) {
            stat.elapsedMs += Math.max(0L, (System.nanoTime() - started) / 1_000_000L);
        }
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        errorsTotal += (int) Math.max(0L, errorCount);
    }

    public synchronized void note(String name, String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        StepStat stat = steps.computeIfAbsent(stepKey(name), StepStat::new);
        stat.note = stat.note.isEmpty() ? text.trim() : stat.note + "; " + text.trim();
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
        }
    }

    public synchronized long totalElapsedMs() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        return Math.max(0L, Duration.between(startedAt, end).toMillis());
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount, stat.note));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("run_mode=").append(runMode).append('\n');
        sb.append("as_of=").append(asOfDate == null ? "-" : asOfDate.toString()).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (!stat.note.isEmpty()) {
                sb.append(" note=").append(stat.note);
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private static String stepKey(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String note = "";

        private StepStat(String name) {
            this.name = name;
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String note
    ) {
    }
}
