package com.chartbot.db.mybatis;

import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;

import java.sql.Connection;

/**
 * Centralized MyBatis bootstrap for the automation mappers.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);
        config.setLogPrefix("SQL.");

        config.addMapper(ScheduleMapper.class);
        config.addMapper(JobLogMapper.class);
        config.addMapper(SignalMapper.class);
        config.addMapper(EconomicContextMapper.class);
        config.addMapper(AccountMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
