package com.scorebot.db;

import com.scorebot.db.mybatis.MyBatisSupport;
import com.scorebot.db.mybatis.ScoreMapper;
import com.scorebot.db.mybatis.ScoreUpsertParam;
import com.scorebot.model.Category;
import com.scorebot.model.ScoreRecord;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Upserts score records into {@code stock_scores}. Each chunk is one transaction; each row is
 * guarded by a savepoint so a bad row does not take its chunk down.
 */
public final class ScoreRecordDao implements ScoreStore {
    private static final Logger LOG = LogManager.getLogger(ScoreRecordDao.class);

    private final Database database;

    public ScoreRecordDao(Database database) {
        this.database = database;
    }

    @Override
    public void upsert(ScoreRecord record) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            session.getMapper(ScoreMapper.class).upsert(toParam(record, OffsetDateTime.now(ZoneOffset.UTC)));
            conn.commit();
        }
    }

    @Override
    public UpsertResult upsertAll(List<ScoreRecord> records, int batchSize) throws SQLException {
        if (records == null || records.isEmpty()) {
            return UpsertResult.empty();
        }
        try (Connection conn = database.connect()) {
            return upsertAll(conn, records, batchSize);
        }
    }

    UpsertResult upsertAll(Connection conn, List<ScoreRecord> records, int batchSize) throws SQLException {
        int chunkSize = Math.max(1, batchSize);
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        UpsertResult total = UpsertResult.empty();
        try (SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            ScoreMapper mapper = session.getMapper(ScoreMapper.class);
            for (int from = 0; from < records.size(); from += chunkSize) {
                List<ScoreRecord> chunk = records.subList(from, Math.min(records.size(), from + chunkSize));
                total = total.plus(writeChunk(conn, mapper, chunk, now));
            }
        }
        return total;
    }

    private UpsertResult writeChunk(Connection conn, ScoreMapper mapper, List<ScoreRecord> chunk, OffsetDateTime now) {
        int written = 0;
        Map<String, String> failures = new LinkedHashMap<>();
        try {
            for (ScoreRecord record : chunk) {
                Savepoint savepoint = conn.setSavepoint();
                try {
                    mapper.upsert(toParam(record, now));
                    conn.releaseSavepoint(savepoint);
                    written++;
                } catch (RuntimeException e) {
                    conn.rollback(savepoint);
                    String reason = rootMessage(e);
                    LOG.warn("Score upsert failed symbol={} as_of={}: {}", record.symbol, record.asOfDate, reason);
                    failures.put(record.symbol, reason);
                }
            }
            conn.commit();
            return new UpsertResult(written, failures.size(), failures);
        } catch (SQLException e) {
            LOG.error("Score chunk write failed, {} rows rolled back: {}", chunk.size(), e.getMessage());
            try {
                conn.rollback();
            } catch (SQLException rollbackError) {
                e.addSuppressed(rollbackError);
                LOG.warn("Rollback after chunk failure also failed: {}", rollbackError.getMessage());
            }
            Map<String, String> all = new LinkedHashMap<>();
            for (ScoreRecord record : chunk) {
                all.put(record.symbol, "chunk_failed: " + e.getMessage());
            }
            return new UpsertResult(0, chunk.size(), all);
        }
    }

    public int countForDate(LocalDate asOfDate) throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return session.getMapper(ScoreMapper.class).countForDate(asOfDate);
        }
    }

    static ScoreUpsertParam toParam(ScoreRecord record, OffsetDateTime updatedAt) {
        JSONObject weights = new JSONObject();
        if (record.appliedWeights != null) {
            for (Map.Entry<Category, Double> entry : record.appliedWeights.entrySet()) {
                weights.put(entry.getKey().label(), entry.getValue());
            }
        }
        JSONObject inputs = new JSONObject();
        if (record.metricInputs != null) {
            for (Map.Entry<String, Double> entry : record.metricInputs.entrySet()) {
                inputs.put(entry.getKey(), entry.getValue() == null ? JSONObject.NULL : entry.getValue());
            }
        }
        JSONArray estimated = new JSONArray(record.estimatedMetrics == null ? List.of() : record.estimatedMetrics);
        return ScoreUpsertParam.builder()
                .symbol(record.symbol)
                .asOfDate(record.asOfDate)
                .compositeScore(record.compositeScore)
                .compositePercentileRank(record.compositePercentileRank)
                .momentumScore(categoryScore(record, Category.MOMENTUM))
                .valueScore(categoryScore(record, Category.VALUE))
                .qualityScore(categoryScore(record, Category.QUALITY))
                .growthScore(categoryScore(record, Category.GROWTH))
                .stabilityScore(categoryScore(record, Category.STABILITY))
                .positioningScore(categoryScore(record, Category.POSITIONING))
                .sentimentScore(record.sentimentScore)
                .completenessRatio(record.completenessRatio)
                .appliedWeightsJson(weights.toString())
                .metricInputsJson(inputs.toString())
                .estimatedMetricsJson(estimated.toString())
                .updatedAt(updatedAt)
                .build();
    }

    private static Double categoryScore(ScoreRecord record, Category category) {
        return record.categoryScores == null ? null : record.categoryScores.get(category);
    }

    private static String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
