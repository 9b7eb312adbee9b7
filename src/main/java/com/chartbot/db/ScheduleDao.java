package com.chartbot.db;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.db.mybatis.JobLogMapper;
import com.chartbot.db.mybatis.JobLogRow;
import com.chartbot.db.mybatis.MyBatisSupport;
import com.chartbot.db.mybatis.ScheduleCompletionParam;
import com.chartbot.db.mybatis.ScheduleMapper;
import com.chartbot.db.mybatis.ScheduleRow;
import com.chartbot.model.Frequency;
import com.chartbot.model.JobLog;
import com.chartbot.model.Schedule;
import com.chartbot.model.SignalAction;
import com.chartbot.store.ScheduleRepository;
import org.apache.ibatis.session.SqlSession;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.chartbot.db.RowCodec.instant;
import static com.chartbot.db.RowCodec.utc;

/**
 * DAO for schedules and their lease columns.
 */
public final class ScheduleDao implements ScheduleRepository {
    private final Database database;

    public ScheduleDao(Database database) {
        this.database = database;
    }

    @Override
    public List<Schedule> findDue(Instant now) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toModels(session.getMapper(ScheduleMapper.class).selectDue(utc(now)));
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("select due schedules failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Schedule> findById(long scheduleId) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(toModel(session.getMapper(ScheduleMapper.class).selectById(scheduleId)));
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("select schedule " + scheduleId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Schedule> findByLayout(String userId, String layoutId) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return Optional.ofNullable(toModel(session.getMapper(ScheduleMapper.class).selectByLayout(userId, layoutId)));
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("select schedule for layout " + layoutId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Schedule> findByUser(String userId) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            return toModels(session.getMapper(ScheduleMapper.class).selectByUser(userId));
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("select schedules for user failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Schedule save(Schedule schedule) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            ScheduleMapper mapper = session.getMapper(ScheduleMapper.class);
            ScheduleRow existing = mapper.selectByLayout(schedule.userId, schedule.layoutId);
            ScheduleRow row = toRow(schedule);
            if (existing == null) {
                mapper.insert(row);
            } else {
                row.setId(existing.getId());
                mapper.updateSettings(row);
            }
            ScheduleRow stored = mapper.selectById(row.getId());
            conn.commit();
            return toModel(stored);
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("save schedule for layout " + schedule.layoutId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Schedule> tryClaim(long scheduleId, Instant now, Instant leaseUntil, boolean requireDue)
            throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            ScheduleRow row = session.getMapper(ScheduleMapper.class)
                    .claim(scheduleId, utc(now), utc(leaseUntil), requireDue);
            conn.commit();
            return Optional.ofNullable(toModel(row));
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("claim schedule " + scheduleId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public JobLog complete(JobLog log, Instant nextRunAt) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            JobLogMapper logMapper = session.getMapper(JobLogMapper.class);
            ScheduleMapper scheduleMapper = session.getMapper(ScheduleMapper.class);

            JobLogRow row = JobLogDao.toRow(log);
            logMapper.insert(row);
            int updated = scheduleMapper.complete(ScheduleCompletionParam.builder()
                    .scheduleId(log.scheduleId)
                    .nextRunAt(utc(nextRunAt))
                    .lastRunAt(utc(log.finishedAt))
                    .lastSignal(log.action == null ? null : log.action.name())
                    .build());
            if (updated != 1) {
                conn.rollback();
                throw new PersistenceException("schedule " + log.scheduleId + " vanished before completion");
            }
            conn.commit();
            return log.toBuilder().id(row.getId()).build();
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("complete schedule " + log.scheduleId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<Schedule> releaseAllLeases(Instant now) throws PersistenceException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            ScheduleMapper mapper = session.getMapper(ScheduleMapper.class);
            List<Schedule> leased = toModels(mapper.selectLeasedForUpdate());
            mapper.releaseAllLeases(utc(now));
            conn.commit();
            return leased;
        } catch (SQLException | RuntimeException e) {
            throw new PersistenceException("release schedule leases failed: " + e.getMessage(), e);
        }
    }

    private List<Schedule> toModels(List<ScheduleRow> rows) {
        List<Schedule> out = new ArrayList<>();
        if (rows == null) {
            return out;
        }
        for (ScheduleRow row : rows) {
            out.add(toModel(row));
        }
        return out;
    }

    static Schedule toModel(ScheduleRow row) {
        if (row == null) {
            return null;
        }
        return Schedule.builder()
                .id(row.getId())
                .userId(row.getUserId())
                .layoutId(row.getLayoutId())
                .enabled(row.isEnabled())
                .frequency(Frequency.fromLabel(row.getFrequency()))
                .sendToTelegram(row.isSendToTelegram())
                .onlyOnSignalChange(row.isOnlyOnSignalChange())
                .minConfidence(row.getMinConfidence())
                .sendOnHold(row.isSendOnHold())
                .nextRunAt(instant(row.getNextRunAt()))
                .lastSignal(SignalAction.fromLabel(row.getLastSignal()))
                .lastRunAt(instant(row.getLastRunAt()))
                .inFlightUntil(instant(row.getInFlightUntil()))
                .claimedAt(instant(row.getClaimedAt()))
                .createdAt(instant(row.getCreatedAt()))
                .updatedAt(instant(row.getUpdatedAt()))
                .build();
    }

    private static ScheduleRow toRow(Schedule schedule) {
        Instant created = schedule.createdAt == null ? Instant.now() : schedule.createdAt;
        return ScheduleRow.builder()
                .id(schedule.id > 0 ? schedule.id : null)
                .userId(schedule.userId)
                .layoutId(schedule.layoutId)
                .enabled(schedule.enabled)
                .frequency(schedule.frequency.label())
                .sendToTelegram(schedule.sendToTelegram)
                .onlyOnSignalChange(schedule.onlyOnSignalChange)
                .minConfidence(schedule.minConfidence)
                .sendOnHold(schedule.sendOnHold)
                .nextRunAt(utc(schedule.nextRunAt))
                .lastSignal(schedule.lastSignal == null ? null : schedule.lastSignal.name())
                .lastRunAt(utc(schedule.lastRunAt))
                .createdAt(utc(created))
                .updatedAt(utc(schedule.updatedAt == null ? created : schedule.updatedAt))
                .build();
    }
}
