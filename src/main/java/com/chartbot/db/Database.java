package com.chartbot.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * PostgreSQL connections pinned to the automation schema.
 * Every connection carries a statement timeout so a hung query cannot outlive a schedule lease.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Logger SQL_LOG = LogManager.getLogger("SQL");
    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final PGSimpleDataSource dataSource = new PGSimpleDataSource();
    private final String jdbcUrl;
    private final String schema;
    private final int statementTimeoutSeconds;
    private final boolean sqlLogEnabled;

    public Database(String jdbcUrl, String user, String pass, String schema,
                    int statementTimeoutSeconds, boolean sqlLogEnabled) {
        String url = jdbcUrl == null ? "" : jdbcUrl.trim();
        if (!url.toLowerCase(Locale.ROOT).startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must be a PostgreSQL JDBC URL (jdbc:postgresql://...), got '"
                    + mask(url) + "'");
        }
        String schemaName = schema == null || schema.isBlank() ? "chartbot" : schema.trim();
        if (!SCHEMA_NAME.matcher(schemaName).matches()) {
            throw new IllegalArgumentException("invalid db.schema '" + schemaName + "'");
        }
        this.jdbcUrl = url;
        this.schema = schemaName;
        this.statementTimeoutSeconds = Math.max(0, statementTimeoutSeconds);
        this.sqlLogEnabled = sqlLogEnabled;

        dataSource.setUrl(url);
        if (user != null && !user.isBlank()) {
            dataSource.setUser(user.trim());
        }
        if (pass != null) {
            dataSource.setPassword(pass);
        }
        dataSource.setCurrentSchema(schemaName);
        dataSource.setApplicationName("chartbot");
    }

    public Connection connect() throws SQLException {
        Connection conn;
        try {
            conn = dataSource.getConnection();
        } catch (SQLException e) {
            String details = "db connect failed url=" + maskedJdbcUrl() + " schema=" + schema
                    + " hint=" + connectHint(e.getMessage()) + " cause=" + e.getMessage();
            LOG.error(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
        try (Statement st = conn.createStatement()) {
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("SET statement_timeout = " + (statementTimeoutSeconds * 1000L));
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        if (sqlLogEnabled) {
            SQL_LOG.debug("connection opened schema={} statement_timeout_s={}", schema, statementTimeoutSeconds);
        }
        return conn;
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        return mask(jdbcUrl);
    }

    static String mask(String url) {
        return url.replaceAll("(?i)(password=)[^&]+", "$1***")
                .replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
    }

    static String connectHint(String message) {
        String msg = message == null ? "" : message.toLowerCase(Locale.ROOT);
        if (msg.contains("password authentication failed")) {
            return "auth";
        }
        if (msg.contains("connection refused") || msg.contains("connection attempt failed")) {
            return "unreachable";
        }
        if (msg.contains("database") && msg.contains("does not exist")) {
            return "missing_database";
        }
        if (msg.contains("permission denied")) {
            return "permission";
        }
        return "connection_error";
    }
}
