package com.chartbot.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface SignalMapper {
    @Insert("INSERT INTO signals(user_id, layout_id, capture_key, model, action, confidence, timeframe, reasons_json, " +
            "trade_setup_json, created_at) " +
            "VALUES(#{userId}, #{layoutId}, #{captureKey}, #{model}, #{action}, #{confidence}, #{timeframe}, #{reasonsJson}, " +
            "#{tradeSetupJson,jdbcType=VARCHAR}, #{createdAt}) " +
            "ON CONFLICT(capture_key) DO UPDATE SET model=excluded.model, action=excluded.action, " +
            "confidence=excluded.confidence, timeframe=excluded.timeframe, reasons_json=excluded.reasons_json, " +
            "trade_setup_json=excluded.trade_setup_json, updated_at=now()")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int upsert(SignalRow row);

    @Select("SELECT id, user_id, layout_id, capture_key, model, action, confidence, timeframe, reasons_json, " +
            "trade_setup_json, created_at FROM signals WHERE capture_key=#{captureKey}")
    SignalRow selectByCaptureKey(@Param("captureKey") String captureKey);
}
