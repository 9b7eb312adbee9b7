package com.chartbot.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationRunnerTest {

    @Test
    void buildStatements_shouldCreateTablesBeforeTheirIndexes() {
        List<String> sqls = MigrationRunner.buildStatements();

        int schedules = indexOf(sqls, "CREATE TABLE IF NOT EXISTS schedules");
        int dueIndex = indexOf(sqls, "idx_schedules_due");
        int jobLogs = indexOf(sqls, "CREATE TABLE IF NOT EXISTS job_logs");
        assertTrue(indexOf(sqls, "CREATE TABLE IF NOT EXISTS users") < indexOf(sqls, "CREATE TABLE IF NOT EXISTS layouts"));
        assertTrue(schedules >= 0 && schedules < dueIndex);
        assertTrue(indexOf(sqls, "CREATE TABLE IF NOT EXISTS signals") < indexOf(sqls, "CREATE TABLE IF NOT EXISTS economic_contexts"));
        assertTrue(schedules < jobLogs);
    }

    @Test
    void buildStatements_shouldEnforceOneSchedulePerLayoutAndConfidenceRange() {
        String schedules = MigrationRunner.buildStatements().get(indexOf(MigrationRunner.buildStatements(),
                "CREATE TABLE IF NOT EXISTS schedules"));

        assertTrue(schedules.contains("layout_id TEXT NOT NULL UNIQUE"));
        assertTrue(schedules.contains("CHECK (min_confidence BETWEEN 0 AND 100)"));
        assertTrue(schedules.contains("in_flight_until"));
    }

    @Test
    void summarizeSql_shouldCollapseWhitespaceAndTruncate() {
        assertEquals("-", MigrationRunner.summarizeSql("  "));
        assertEquals("SELECT 1 FROM dual", MigrationRunner.summarizeSql("SELECT 1\n   FROM\tdual"));
        String longSql = "SELECT " + "x, ".repeat(100) + "y";
        String summary = MigrationRunner.summarizeSql(longSql);
        assertEquals(180, summary.length());
        assertTrue(summary.endsWith("..."));
    }

    private static int indexOf(List<String> sqls, String fragment) {
        for (int i = 0; i < sqls.size(); i++) {
            if (sqls.get(i).contains(fragment)) {
                return i;
            }
        }
        return -1;
    }
}
