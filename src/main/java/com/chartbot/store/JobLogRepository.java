package com.chartbot.store;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.model.JobLog;

import java.util.List;

public interface JobLogRepository {
    /**
     * Appends a log row without touching the schedule. Used when the completion transaction itself failed.
     */
    JobLog append(JobLog log) throws PersistenceException;

    /**
     * Newest first. A null scheduleId means every schedule the user owns.
     */
    List<JobLog> listForUser(String userId, Long scheduleId, int limit) throws PersistenceException;
}
