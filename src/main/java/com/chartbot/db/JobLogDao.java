package com.chartbot.db;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.db.mybatis.JobLogMapper;
import com.chartbot.db.mybatis.JobLogRow;
import com.chartbot.db.mybatis.MyBatisSupport;
import com.chartbot.model.DecisionReason;
import com.chartbot.model.JobLog;
import com.chartbot.model.JobStatus;
import com.chartbot.model.JobTrigger;
import com.chartbot.model.SignalAction;
import com.chartbot.store.JobLogRepository;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.chartbot.db.RowCodec.instant;
import static com.chartbot.db.RowCodec.utc;

public final class JobLogDao implements JobLogRepository {
    private final Database database;

    public JobLogDao(Database database) {
        this.database = database;
    }

    @Override
    public JobLog append(JobLog log) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            JobLogRow row = toRow(log);
            session.getMapper(JobLogMapper.class).insert(row);
            conn.commit();
            return log.toBuilder().id(row.getId()).build();
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("append job log for schedule " + log.scheduleId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<JobLog> listForUser(String userId, Long scheduleId, int limit) throws PersistenceException {
        int clamped = Math.max(1, limit);
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            JobLogMapper mapper = session.getMapper(JobLogMapper.class);
            List<JobLogRow> rows = scheduleId == null
                    ? mapper.selectForUser(userId, clamped)
                    : mapper.selectForUserSchedule(userId, scheduleId, clamped);
            List<JobLog> out = new ArrayList<>();
            for (JobLogRow row : rows) {
                out.add(toModel(row));
            }
            return out;
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("list job logs failed: " + e.getMessage(), e);
        }
    }

    static JobLogRow toRow(JobLog log) {
        return JobLogRow.builder()
                .scheduleId(log.scheduleId)
                .triggerType(log.trigger == null ? JobTrigger.TICK.name().toLowerCase(Locale.ROOT)
                        : log.trigger.name().toLowerCase(Locale.ROOT))
                .startedAt(utc(log.startedAt))
                .finishedAt(utc(log.finishedAt))
                .status(log.status == null ? JobStatus.INCOMPLETE.label() : log.status.label())
                .signalId(log.signalId)
                .action(log.action == null ? null : log.action.name())
                .confidence(log.confidence)
                .decisionReason(log.reason == null ? null : log.reason.label())
                .telegramSent(log.telegramSent)
                .error(log.error)
                .durationMs(Math.max(0L, log.durationMs))
                .build();
    }

    static JobLog toModel(JobLogRow row) {
        return JobLog.builder()
                .id(row.getId())
                .scheduleId(row.getScheduleId())
                .trigger(parseTrigger(row.getTriggerType()))
                .startedAt(instant(row.getStartedAt()))
                .finishedAt(instant(row.getFinishedAt()))
                .status(JobStatus.fromLabel(row.getStatus()))
                .signalId(row.getSignalId())
                .action(SignalAction.fromLabel(row.getAction()))
                .confidence(row.getConfidence())
                .reason(DecisionReason.fromLabel(row.getDecisionReason()))
                .telegramSent(row.isTelegramSent())
                .error(row.getError())
                .durationMs(row.getDurationMs())
                .build();
    }

    private static JobTrigger parseTrigger(String raw) {
        if (raw == null) {
            return JobTrigger.TICK;
        }
        try {
            return JobTrigger.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return JobTrigger.TICK;
        }
    }
}
