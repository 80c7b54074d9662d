package com.scorebot.db;

import com.scorebot.model.ScoreRecord;

import java.sql.SQLException;
import java.util.List;

/**
 * Destination for computed score records, keyed by (symbol, as_of_date). Writes fully replace.
 */
public interface ScoreStore {

    void upsert(ScoreRecord record) throws SQLException;

    /**
     * Writes in chunks of {@code batchSize}. A row that fails is counted and skipped; the rest of
     * its chunk is still written.
     */
    UpsertResult upsertAll(List<ScoreRecord> records, int batchSize) throws SQLException;
}
