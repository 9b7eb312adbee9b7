package com.chartbot.db;

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
 * Idempotent PostgreSQL schema migration runner.
 *
 * <p>The {@code users} and {@code layouts} tables belong to the surrounding application; they are created here
 * only when missing so a fresh database can run automation end to end.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

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
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            LOG.info("migration done schema={} from_version={} to_version={}", schema, currentVersion, TARGET_VERSION);
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS users (" +
                "id TEXT PRIMARY KEY," +
                "tv_session_id TEXT NULL," +
                "tv_session_id_sign TEXT NULL," +
                "telegram_chat_id TEXT NULL," +
                "telegram_include_chart BOOLEAN NULL," +
                "telegram_include_economic BOOLEAN NULL," +
                "preferred_model TEXT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS layouts (" +
                "id TEXT PRIMARY KEY," +
                "user_id TEXT NOT NULL REFERENCES users(id) ON DELETE CASCADE," +
                "capture_target_id TEXT NULL," +
                "symbol TEXT NULL," +
                "chart_interval TEXT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS schedules (" +
                "id BIGSERIAL PRIMARY KEY," +
                "user_id TEXT NOT NULL," +
                "layout_id TEXT NOT NULL UNIQUE," +
                "enabled BOOLEAN NOT NULL DEFAULT TRUE," +
                "frequency TEXT NOT NULL," +
                "send_to_telegram BOOLEAN NOT NULL DEFAULT TRUE," +
                "only_on_signal_change BOOLEAN NOT NULL DEFAULT FALSE," +
                "min_confidence INTEGER NOT NULL DEFAULT 0 CHECK (min_confidence BETWEEN 0 AND 100)," +
                "send_on_hold BOOLEAN NOT NULL DEFAULT FALSE," +
                "next_run_at TIMESTAMPTZ NOT NULL," +
                "last_signal TEXT NULL," +
                "last_run_at TIMESTAMPTZ NULL," +
                "in_flight_until TIMESTAMPTZ NULL," +
                "claimed_at TIMESTAMPTZ NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_schedules_due ON schedules(enabled, next_run_at)");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_schedules_user ON schedules(user_id)");

        sqls.add("CREATE TABLE IF NOT EXISTS signals (" +
                "id BIGSERIAL PRIMARY KEY," +
                "user_id TEXT NOT NULL," +
                "layout_id TEXT NOT NULL," +
                "capture_key TEXT NOT NULL UNIQUE," +
                "model TEXT NOT NULL," +
                "action TEXT NOT NULL," +
                "confidence INTEGER NOT NULL," +
                "timeframe TEXT NOT NULL," +
                "reasons_json TEXT NOT NULL," +
                "trade_setup_json TEXT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_signals_layout ON signals(layout_id, created_at)");

        sqls.add("CREATE TABLE IF NOT EXISTS economic_contexts (" +
                "id BIGSERIAL PRIMARY KEY," +
                "signal_id BIGINT NOT NULL UNIQUE REFERENCES signals(id) ON DELETE CASCADE," +
                "symbol TEXT NOT NULL," +
                "immediate_risk TEXT NOT NULL," +
                "weekly_outlook TEXT NOT NULL," +
                "impact_summary TEXT NOT NULL," +
                "warnings_json TEXT NOT NULL," +
                "opportunities_json TEXT NOT NULL," +
                "recommendation TEXT NOT NULL," +
                "upcoming_events_json TEXT NOT NULL," +
                "weekly_events_json TEXT NOT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS job_logs (" +
                "id BIGSERIAL PRIMARY KEY," +
                "schedule_id BIGINT NOT NULL REFERENCES schedules(id) ON DELETE CASCADE," +
                "trigger_type TEXT NOT NULL," +
                "started_at TIMESTAMPTZ NOT NULL," +
                "finished_at TIMESTAMPTZ NOT NULL," +
                "status TEXT NOT NULL," +
                "signal_id BIGINT NULL," +
                "action TEXT NULL," +
                "confidence INTEGER NULL," +
                "decision_reason TEXT NULL," +
                "telegram_sent BOOLEAN NOT NULL DEFAULT FALSE," +
                "error TEXT NULL," +
                "duration_ms BIGINT NOT NULL DEFAULT 0" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_job_logs_schedule ON job_logs(schedule_id, started_at DESC)");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'")) {
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    String value = rs.getString(1);
                    if (value != null && !value.trim().isEmpty()) {
                        return Integer.parseInt(value.trim());
                    }
                }
            }
        } catch (SQLException | NumberFormatException e) {
            LOG.warn("schema_version unreadable, assuming 0: {}", e.getMessage());
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

    static String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
