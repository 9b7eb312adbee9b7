package com.chartbot.db;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.db.mybatis.MyBatisSupport;
import com.chartbot.db.mybatis.SignalMapper;
import com.chartbot.db.mybatis.SignalRow;
import com.chartbot.model.Signal;
import com.chartbot.model.SignalAction;
import com.chartbot.store.SignalRepository;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;

import static com.chartbot.db.RowCodec.instant;
import static com.chartbot.db.RowCodec.utc;

public final class SignalDao implements SignalRepository {
    private final Database database;

    public SignalDao(Database database) {
        this.database = database;
    }

    @Override
    public Signal upsert(Signal signal) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            SignalRow row = SignalRow.builder()
                    .userId(signal.userId)
                    .layoutId(signal.layoutId)
                    .captureKey(signal.captureKey)
                    .model(signal.model)
                    .action(signal.action.name())
                    .confidence(signal.confidence)
                    .timeframe(signal.timeframe)
                    .reasonsJson(RowCodec.stringsToJson(signal.reasons))
                    .tradeSetupJson(RowCodec.tradeSetupToJson(signal.tradeSetup))
                    .createdAt(utc(signal.createdAt == null ? Instant.now() : signal.createdAt))
                    .build();
            session.getMapper(SignalMapper.class).upsert(row);
            conn.commit();
            return signal.withId(row.getId());
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("upsert signal " + signal.captureKey + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Signal> findByCaptureKey(String captureKey) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            SignalRow row = session.getMapper(SignalMapper.class).selectByCaptureKey(captureKey);
            if (row == null) {
                return Optional.empty();
            }
            return Optional.of(Signal.builder()
                    .id(row.getId())
                    .userId(row.getUserId())
                    .layoutId(row.getLayoutId())
                    .captureKey(row.getCaptureKey())
                    .model(row.getModel())
                    .action(SignalAction.fromLabel(row.getAction()))
                    .confidence(row.getConfidence())
                    .timeframe(row.getTimeframe())
                    .reasons(RowCodec.jsonToStrings(row.getReasonsJson()))
                    .tradeSetup(RowCodec.jsonToTradeSetup(row.getTradeSetupJson()))
                    .createdAt(instant(row.getCreatedAt()))
                    .build());
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("select signal " + captureKey + " failed: " + e.getMessage(), e);
        }
    }
}
