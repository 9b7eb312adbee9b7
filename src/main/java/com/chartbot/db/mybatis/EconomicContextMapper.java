package com.chartbot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface EconomicContextMapper {
    @Insert("INSERT INTO economic_contexts(signal_id, symbol, immediate_risk, weekly_outlook, impact_summary, warnings_json, " +
            "opportunities_json, recommendation, upcoming_events_json, weekly_events_json, created_at) " +
            "VALUES(#{signalId}, #{symbol}, #{immediateRisk}, #{weeklyOutlook}, #{impactSummary}, #{warningsJson}, " +
            "#{opportunitiesJson}, #{recommendation}, #{upcomingEventsJson}, #{weeklyEventsJson}, #{createdAt}) " +
            "ON CONFLICT(signal_id) DO UPDATE SET symbol=excluded.symbol, immediate_risk=excluded.immediate_risk, " +
            "weekly_outlook=excluded.weekly_outlook, impact_summary=excluded.impact_summary, " +
            "warnings_json=excluded.warnings_json, opportunities_json=excluded.opportunities_json, " +
            "recommendation=excluded.recommendation, upcoming_events_json=excluded.upcoming_events_json, " +
            "weekly_events_json=excluded.weekly_events_json, updated_at=now()")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int upsert(EconomicContextRow row);

    @Select("SELECT id, signal_id, symbol, immediate_risk, weekly_outlook, impact_summary, warnings_json, opportunities_json, " +
            "recommendation, upcoming_events_json, weekly_events_json, created_at " +
            "FROM economic_contexts WHERE signal_id=#{signalId}")
    EconomicContextRow selectBySignalId(@Param("signalId") long signalId);
}
