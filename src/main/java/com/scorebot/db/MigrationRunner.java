package com.scorebot.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration. Safe to run before every pipeline run.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);

    public static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + SqlLogProxy.oneLine(lastSql)
                        + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != TARGET_VERSION) {
                LOG.info("Schema {} migrated from version {} to {}", schema, currentVersion, TARGET_VERSION);
            }
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();
        sqls.add("CREATE TABLE IF NOT EXISTS symbols (" +
                "ticker TEXT PRIMARY KEY," +
                "sector TEXT NULL," +
                "asset_type TEXT NOT NULL DEFAULT 'EQUITY'," +
                "active BOOLEAN NOT NULL DEFAULT TRUE," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS stock_scores (" +
                "symbol TEXT NOT NULL," +
                "as_of_date DATE NOT NULL," +
                "composite_score DOUBLE PRECISION NULL," +
                "composite_percentile_rank DOUBLE PRECISION NULL," +
                "momentum_score DOUBLE PRECISION NULL," +
                "value_score DOUBLE PRECISION NULL," +
                "quality_score DOUBLE PRECISION NULL," +
                "growth_score DOUBLE PRECISION NULL," +
                "stability_score DOUBLE PRECISION NULL," +
                "positioning_score DOUBLE PRECISION NULL," +
                "sentiment_score DOUBLE PRECISION NULL," +
                "completeness_ratio DOUBLE PRECISION NOT NULL DEFAULT 0," +
                "applied_weights JSONB NOT NULL DEFAULT '{}'::jsonb," +
                "metric_inputs JSONB NOT NULL DEFAULT '{}'::jsonb," +
                "estimated_metrics JSONB NOT NULL DEFAULT '[]'::jsonb," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "PRIMARY KEY (symbol, as_of_date)," +
                "CHECK (composite_score IS NULL OR (composite_score >= 0 AND composite_score <= 100))" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS idx_symbols_active ON symbols(active)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_stock_scores_date_composite ON stock_scores(as_of_date, composite_score DESC)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && !value.trim().isEmpty()) {
                    try {
                        return Integer.parseInt(value.trim());
                    } catch (NumberFormatException e) {
                        LOG.warn("Unreadable schema_version '{}', treating as 0", value);
                        return 0;
                    }
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }
}
