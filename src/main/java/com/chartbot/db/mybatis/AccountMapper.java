package com.chartbot.db.mybatis;

import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

public interface AccountMapper {
    @Select("SELECT id, user_id, capture_target_id, symbol, chart_interval FROM layouts WHERE id=#{id}")
    LayoutRow selectLayout(@Param("id") String id);

    @Select("SELECT id, tv_session_id, tv_session_id_sign, telegram_chat_id, telegram_include_chart, " +
            "telegram_include_economic, preferred_model FROM users WHERE id=#{id}")
    AccountRow selectAccount(@Param("id") String id);
}
