package com.scorebot.runner;

import com.scorebot.core.RunTelemetry;
import com.scorebot.model.RunSummary;
import com.scorebot.model.ScoreRecord;

import java.util.List;

public final class PipelineResult {
    public final RunSummary summary;
    public final List<ScoreRecord> records;
    public final RunTelemetry telemetry;

    PipelineResult(RunSummary summary, List<ScoreRecord> records, RunTelemetry telemetry) {
        this.summary = summary;
        this.records = List.copyOf(records);
        this.telemetry = telemetry;
    }

    public ScoreRecord record(String ticker) {
        for (ScoreRecord record : records) {
            if (record.symbol.equals(ticker)) {
                return record;
            }
        }
        return null;
    }
}
