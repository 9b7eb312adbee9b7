package com.chartbot.store;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.model.JobLog;
import com.chartbot.model.Schedule;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Schedule persistence, including the lease columns used for per-schedule exclusivity.
 */
public interface ScheduleRepository {
    /**
     * Enabled schedules with nextRunAt at or before {@code now} and no unexpired lease, oldest first.
     */
    List<Schedule> findDue(Instant now) throws PersistenceException;

    Optional<Schedule> findById(long scheduleId) throws PersistenceException;

    Optional<Schedule> findByLayout(String userId, String layoutId) throws PersistenceException;

    List<Schedule> findByUser(String userId) throws PersistenceException;

    /**
     * Inserts or updates by (userId, layoutId) and returns the stored row.
     */
    Schedule save(Schedule schedule) throws PersistenceException;

    /**
     * Atomically takes the lease when none is held or the held one has expired. With {@code requireDue} the
     * schedule must also still be enabled with nextRunAt at or before {@code now} at claim time.
     *
     * @return the schedule as stored once this caller owns the lease, empty when the claim was refused
     */
    Optional<Schedule> tryClaim(long scheduleId, Instant now, Instant leaseUntil, boolean requireDue)
            throws PersistenceException;

    /**
     * Appends the job log and advances the schedule in one transaction, clearing the lease.
     * {@code lastSignal} is left untouched when null.
     */
    JobLog complete(JobLog log, Instant nextRunAt) throws PersistenceException;

    /**
     * Clears every lease still held and returns the schedules that held one.
     */
    List<Schedule> releaseAllLeases(Instant now) throws PersistenceException;
}
