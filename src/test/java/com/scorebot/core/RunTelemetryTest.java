package com.scorebot.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("dry_run", LocalDate.of(2026, 3, 2), Instant.parse("2026-03-02T21:00:00Z"));
        telemetry.startStep(RunTelemetry.STEP_FETCH);
        telemetry.endStep(RunTelemetry.STEP_FETCH, 10, 8, 2);
        telemetry.note(RunTelemetry.STEP_FETCH, "deferred_recovered=1");
        telemetry.startStep(RunTelemetry.STEP_SCORE);
        telemetry.endStep(RunTelemetry.STEP_SCORE, 8, 8, 0);
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("run_mode=DRY_RUN"));
        assertTrue(summary.contains("as_of=2026-03-02"));
        assertTrue(summary.contains("errors_total=2"));
        assertTrue(summary.contains("steps:"));
        assertTrue(summary.contains("FETCH elapsed_ms="));
        assertTrue(summary.contains("in=10 out=8 err=2 note=deferred_recovered=1"));
    }

    @Test
    void stepRecords_shouldAccumulateRepeatedSteps() {
        RunTelemetry telemetry = new RunTelemetry(null, null, null);
        telemetry.startStep("persist");
        telemetry.endStep(RunTelemetry.STEP_PERSIST, 3, 3, 0);
        telemetry.startStep(RunTelemetry.STEP_PERSIST);
        telemetry.endStep(RunTelemetry.STEP_PERSIST, 2, 1, 1);

        List<RunTelemetry.StepRecord> records = telemetry.stepRecords();

        assertEquals(1, records.size());
        assertEquals(RunTelemetry.STEP_PERSIST, records.get(0).name());
        assertEquals(5L, records.get(0).itemsIn());
        assertEquals(4L, records.get(0).itemsOut());
        assertEquals(1, telemetry.errorsTotal());
        assertTrue(telemetry.getSummary().contains("run_mode=SCORE"));
    }
}
