package com.chartbot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

import java.util.List;

public interface JobLogMapper {
    String COLUMNS = "j.id, j.schedule_id, j.trigger_type, j.started_at, j.finished_at, j.status, j.signal_id, j.action, " +
            "j.confidence, j.decision_reason, j.telegram_sent, j.error, j.duration_ms";

    @Insert("INSERT INTO job_logs(schedule_id, trigger_type, started_at, finished_at, status, signal_id, action, confidence, " +
            "decision_reason, telegram_sent, error, duration_ms) " +
            "VALUES(#{scheduleId}, #{triggerType}, #{startedAt}, #{finishedAt}, #{status}, #{signalId,jdbcType=BIGINT}, " +
            "#{action,jdbcType=VARCHAR}, #{confidence,jdbcType=INTEGER}, #{decisionReason,jdbcType=VARCHAR}, #{telegramSent}, " +
            "#{error,jdbcType=VARCHAR}, #{durationMs})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(JobLogRow row);

    @Select("SELECT " + COLUMNS + " FROM job_logs j JOIN schedules s ON s.id = j.schedule_id " +
            "WHERE s.user_id=#{userId} ORDER BY j.started_at DESC, j.id DESC LIMIT #{limit}")
    List<JobLogRow> selectForUser(@Param("userId") String userId, @Param("limit") int limit);

    @Select("SELECT " + COLUMNS + " FROM job_logs j JOIN schedules s ON s.id = j.schedule_id " +
            "WHERE s.user_id=#{userId} AND j.schedule_id=#{scheduleId} " +
            "ORDER BY j.started_at DESC, j.id DESC LIMIT #{limit}")
    List<JobLogRow> selectForUserSchedule(
            @Param("userId") String userId,
            @Param("scheduleId") long scheduleId,
            @Param("limit") int limit
    );
}
