package com.scorebot.db;

import com.scorebot.db.mybatis.ScoreUpsertParam;
import com.scorebot.model.Category;
import com.scorebot.model.CategoryScores;
import com.scorebot.model.ScoreRecord;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import java.lang.reflect.Proxy;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoreRecordDaoTest {

    @Test
    void toParam_shouldSpreadCategoriesAndSerializeAuditColumns() {
        Map<Category, Double> scores = new EnumMap<>(Category.class);
        scores.put(Category.MOMENTUM, 71.5);
        scores.put(Category.VALUE, 33.0);
        Map<Category, Double> weights = new EnumMap<>(Category.class);
        weights.put(Category.MOMENTUM, 0.6);
        weights.put(Category.VALUE, 0.4);
        Map<String, Double> inputs = new LinkedHashMap<>();
        inputs.put("momentum_3m", 12.0);
        inputs.put("beta", null);
        ScoreRecord record = ScoreRecord.builder()
                .symbol("MSFT")
                .asOfDate(LocalDate.of(2026, 3, 2))
                .compositeScore(56.1)
                .compositePercentileRank(80.0)
                .categoryScores(new CategoryScores(scores))
                .sentimentScore(64.0)
                .appliedWeights(weights)
                .metricInputs(inputs)
                .estimatedMetrics(List.of("sustainable_growth_rate"))
                .completenessRatio(0.5)
                .build();
        OffsetDateTime now = OffsetDateTime.of(2026, 3, 2, 21, 0, 0, 0, ZoneOffset.UTC);

        ScoreUpsertParam param = ScoreRecordDao.toParam(record, now);

        assertEquals("MSFT", param.getSymbol());
        assertEquals(71.5, param.getMomentumScore(), 1e-12);
        assertEquals(33.0, param.getValueScore(), 1e-12);
        assertNull(param.getGrowthScore());
        assertEquals(64.0, param.getSentimentScore(), 1e-12);
        assertEquals(0.5, param.getCompletenessRatio(), 1e-12);
        assertEquals(now, param.getUpdatedAt());

        JSONObject appliedWeights = new JSONObject(param.getAppliedWeightsJson());
        assertEquals(0.6, appliedWeights.getDouble("momentum"), 1e-12);
        JSONObject metricInputs = new JSONObject(param.getMetricInputsJson());
        assertTrue(metricInputs.has("beta"));
        assertTrue(metricInputs.isNull("beta"));
        assertEquals("sustainable_growth_rate", new JSONArray(param.getEstimatedMetricsJson()).getString(0));
    }

    @Test
    void toParam_shouldKeepNullCompositeNull() {
        ScoreRecord record = ScoreRecord.builder()
                .symbol("NODATA")
                .asOfDate(LocalDate.of(2026, 3, 2))
                .categoryScores(new CategoryScores(Map.of()))
                .appliedWeights(Map.of())
                .metricInputs(Map.of())
                .estimatedMetrics(List.of())
                .build();

        ScoreUpsertParam param = ScoreRecordDao.toParam(record, OffsetDateTime.now(ZoneOffset.UTC));

        assertNull(param.getCompositeScore());
        assertNull(param.getCompositePercentileRank());
        assertEquals("{}", param.getAppliedWeightsJson());
        assertEquals("[]", param.getEstimatedMetricsJson());
    }

    @Test
    void upsertAll_shouldSkipFailingRowAndCommitTheRest() throws Exception {
        List<String> calls = new ArrayList<>();
        Connection conn = recordingConnection(calls, "BAD");
        List<ScoreRecord> records = List.of(record("AAA"), record("BAD"), record("CCC"));

        UpsertResult result = new ScoreRecordDao(null).upsertAll(conn, records, 2);

        assertEquals(2, result.written);
        assertEquals(1, result.failed);
        assertEquals(Map.of("BAD", "value too long for type"), result.failures);
        assertEquals(1, calls.stream().filter("rollback:savepoint"::equals).count());
        assertEquals(2, calls.stream().filter("releaseSavepoint:savepoint"::equals).count());
        assertEquals(2, calls.stream().filter("commit"::equals).count());
        assertTrue(calls.indexOf("rollback:savepoint") < calls.indexOf("commit"));
    }

    private static ScoreRecord record(String symbol) {
        return ScoreRecord.builder()
                .symbol(symbol)
                .asOfDate(LocalDate.of(2026, 3, 2))
                .compositeScore(50.0)
                .categoryScores(new CategoryScores(Map.of(Category.VALUE, 50.0)))
                .appliedWeights(Map.of(Category.VALUE, 1.0))
                .metricInputs(Map.of())
                .estimatedMetrics(List.of())
                .completenessRatio(1.0)
                .build();
    }

    /**
     * JDBC connection that records transaction calls and fails the insert of {@code failingSymbol}.
     */
    private static Connection recordingConnection(List<String> calls, String failingSymbol) {
        Savepoint savepoint = new Savepoint() {
            @Override
            public int getSavepointId() {
                return 1;
            }

            @Override
            public String getSavepointName() {
                return "row";
            }
        };
        boolean[] autoCommit = {true};
        return (Connection) Proxy.newProxyInstance(
                Connection.class.getClassLoader(),
                new Class<?>[]{Connection.class},
                (proxy, method, args) -> {
                    String name = method.getName();
                    boolean withSavepoint = args != null && args.length == 1 && args[0] instanceof Savepoint;
                    calls.add(withSavepoint ? name + ":savepoint" : name);
                    switch (name) {
                        case "setAutoCommit":
                            autoCommit[0] = (Boolean) args[0];
                            return null;
                        case "getAutoCommit":
                            return autoCommit[0];
                        case "setSavepoint":
                            return savepoint;
                        case "prepareStatement":
                            return failingStatement(failingSymbol);
                        default:
                            return defaultValue(method.getReturnType());
                    }
                }
        );
    }

    private static PreparedStatement failingStatement(String failingSymbol) {
        String[] symbol = {null};
        return (PreparedStatement) Proxy.newProxyInstance(
                PreparedStatement.class.getClassLoader(),
                new Class<?>[]{PreparedStatement.class},
                (proxy, method, args) -> {
                    String name = method.getName();
                    if ("setString".equals(name) && Integer.valueOf(1).equals(args[0])) {
                        symbol[0] = (String) args[1];
                    }
                    if (name.startsWith("execute")) {
                        if (failingSymbol.equals(symbol[0])) {
                            throw new SQLException("value too long for type", "22001");
                        }
                        return "execute".equals(name) ? Boolean.FALSE : defaultValue(method.getReturnType());
                    }
                    if ("getUpdateCount".equals(name)) {
                        return 1;
                    }
                    return defaultValue(method.getReturnType());
                }
        );
    }

    private static Object defaultValue(Class<?> type) {
        if (type == boolean.class) {
            return false;
        }
        if (type == int.class) {
            return 0;
        }
        if (type == long.class) {
            return 0L;
        }
        return null;
    }
}
