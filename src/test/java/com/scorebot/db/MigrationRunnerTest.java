package com.scorebot.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationRunnerTest {

    @Test
    void buildStatements_shouldBeIdempotentAndKeyScoresBySymbolAndDate() {
        List<String> statements = MigrationRunner.buildStatements();

        for (String sql : statements) {
            assertTrue(sql.contains("IF NOT EXISTS"), sql);
        }
        String scores = statements.stream().filter(s -> s.contains("stock_scores (")).findFirst().orElseThrow();
        assertTrue(scores.contains("PRIMARY KEY (symbol, as_of_date)"));
        assertTrue(scores.contains("composite_score DOUBLE PRECISION NULL"));
        assertTrue(scores.contains("sentiment_score DOUBLE PRECISION NULL"));
        assertTrue(scores.contains("metric_inputs JSONB"));
    }
}
