package com.chartbot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;
import java.util.List;

public interface ScheduleMapper {
    String COLUMNS = "id, user_id, layout_id, enabled, frequency, send_to_telegram, only_on_signal_change, min_confidence, " +
            "send_on_hold, next_run_at, last_signal, last_run_at, in_flight_until, claimed_at, created_at, updated_at";

    @Select("SELECT " + COLUMNS + " FROM schedules " +
            "WHERE enabled = TRUE AND next_run_at <= #{now} " +
            "AND (in_flight_until IS NULL OR in_flight_until <= #{now}) " +
            "ORDER BY next_run_at ASC, id ASC")
    List<ScheduleRow> selectDue(@Param("now") OffsetDateTime now);

    @Select("SELECT " + COLUMNS + " FROM schedules WHERE id=#{id}")
    ScheduleRow selectById(@Param("id") long id);

    @Select("SELECT " + COLUMNS + " FROM schedules WHERE user_id=#{userId} AND layout_id=#{layoutId}")
    ScheduleRow selectByLayout(@Param("userId") String userId, @Param("layoutId") String layoutId);

    @Select("SELECT " + COLUMNS + " FROM schedules WHERE user_id=#{userId} ORDER BY created_at DESC, id DESC")
    List<ScheduleRow> selectByUser(@Param("userId") String userId);

    @Insert("INSERT INTO schedules(user_id, layout_id, enabled, frequency, send_to_telegram, only_on_signal_change, " +
            "min_confidence, send_on_hold, next_run_at, last_signal, last_run_at, created_at, updated_at) " +
            "VALUES(#{userId}, #{layoutId}, #{enabled}, #{frequency}, #{sendToTelegram}, #{onlyOnSignalChange}, " +
            "#{minConfidence}, #{sendOnHold}, #{nextRunAt}, #{lastSignal,jdbcType=VARCHAR}, " +
            "#{lastRunAt,jdbcType=TIMESTAMP_WITH_TIMEZONE}, #{createdAt}, #{updatedAt})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(ScheduleRow row);

    @Update("UPDATE schedules SET enabled=#{enabled}, frequency=#{frequency}, send_to_telegram=#{sendToTelegram}, " +
            "only_on_signal_change=#{onlyOnSignalChange}, min_confidence=#{minConfidence}, send_on_hold=#{sendOnHold}, " +
            "next_run_at=#{nextRunAt}, updated_at=#{updatedAt} WHERE id=#{id}")
    int updateSettings(ScheduleRow row);

    @Select("UPDATE schedules SET in_flight_until=#{leaseUntil}, claimed_at=#{now} " +
            "WHERE id=#{id} AND (in_flight_until IS NULL OR in_flight_until <= #{now}) " +
            "AND (#{requireDue} = FALSE OR (enabled = TRUE AND next_run_at <= #{now})) " +
            "RETURNING " + COLUMNS)
    @Options(flushCache = Options.FlushCachePolicy.TRUE, useCache = false)
    ScheduleRow claim(@Param("id") long id, @Param("now") OffsetDateTime now,
                      @Param("leaseUntil") OffsetDateTime leaseUntil, @Param("requireDue") boolean requireDue);

    @Update("UPDATE schedules SET next_run_at=#{nextRunAt}, last_run_at=#{lastRunAt}, " +
            "last_signal=COALESCE(#{lastSignal,jdbcType=VARCHAR}, last_signal), " +
            "in_flight_until=NULL, claimed_at=NULL, updated_at=#{lastRunAt} WHERE id=#{scheduleId}")
    int complete(ScheduleCompletionParam param);

    @Select("SELECT " + COLUMNS + " FROM schedules WHERE in_flight_until IS NOT NULL ORDER BY id FOR UPDATE")
    List<ScheduleRow> selectLeasedForUpdate();

    @Update("UPDATE schedules SET in_flight_until=NULL, claimed_at=NULL, updated_at=#{now} WHERE in_flight_until IS NOT NULL")
    int releaseAllLeases(@Param("now") OffsetDateTime now);
}
