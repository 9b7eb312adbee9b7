package com.chartbot.automation;

import com.chartbot.automation.error.PersistenceException;
import com.chartbot.automation.error.ScheduleNotFoundException;
import com.chartbot.automation.error.ValidationException;
import com.chartbot.model.Frequency;
import com.chartbot.model.JobLog;
import com.chartbot.model.Layout;
import com.chartbot.model.Schedule;
import com.chartbot.model.TriggerResult;
import com.chartbot.store.AccountRepository;
import com.chartbot.store.JobLogRepository;
import com.chartbot.store.ScheduleRepository;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Management surface: schedule upsert, manual trigger and job log queries.
 */
public final class ScheduleService {
    private static final Logger LOG = LogManager.getLogger(ScheduleService.class);

    public static final Frequency DEFAULT_FREQUENCY = Frequency.ONE_HOUR;
    public static final int DEFAULT_MIN_CONFIDENCE = 50;
    public static final int DEFAULT_LOG_LIMIT = 50;
    public static final int MAX_LOG_LIMIT = 200;

    private final ScheduleRepository schedules;
    private final AccountRepository accounts;
    private final JobLogRepository jobLogs;
    private final SchedulerLoop loop;
    private final Clock clock;

    public ScheduleService(
            ScheduleRepository schedules,
            AccountRepository accounts,
            JobLogRepository jobLogs,
            SchedulerLoop loop,
            Clock clock
    ) {
        this.schedules = schedules;
        this.accounts = accounts;
        this.jobLogs = jobLogs;
        this.loop = loop;
        this.clock = clock;
    }

    /**
     * Creates the layout's schedule or updates it in place. Either way nextRunAt is reset to now.
     */
    public Schedule upsert(String userId, ScheduleRequest request) throws ValidationException, PersistenceException {
        if (isBlank(userId)) {
            throw new ValidationException("userId is required");
        }
        if (request == null || isBlank(request.getLayoutId())) {
            throw new ValidationException("layoutId is required");
        }
        String layoutId = request.getLayoutId().trim();
        Optional<Layout> layout = accounts.findLayout(layoutId);
        if (layout.isEmpty() || !userId.equals(layout.get().userId)) {
            throw new ValidationException("layout " + layoutId + " not found for user");
        }
        Frequency frequency = null;
        if (request.getFrequency() != null) {
            try {
                frequency = Frequency.fromLabel(request.getFrequency());
            } catch (IllegalArgumentException e) {
                throw new ValidationException(e.getMessage());
            }
        }
        Integer minConfidence = request.getMinConfidence();
        if (minConfidence != null && (minConfidence < 0 || minConfidence > 100)) {
            throw new ValidationException("minConfidence must be between 0 and 100, got " + minConfidence);
        }

        Instant now = clock.instant();
        Optional<Schedule> existing = schedules.findByLayout(userId, layoutId);
        Schedule merged;
        if (existing.isPresent()) {
            Schedule current = existing.get();
            merged = current.toBuilder()
                    .enabled(orElse(request.getEnabled(), current.enabled))
                    .frequency(frequency == null ? current.frequency : frequency)
                    .sendToTelegram(orElse(request.getSendToTelegram(), current.sendToTelegram))
                    .onlyOnSignalChange(orElse(request.getOnlyOnSignalChange(), current.onlyOnSignalChange))
                    .minConfidence(minConfidence == null ? current.minConfidence : minConfidence)
                    .sendOnHold(orElse(request.getSendOnHold(), current.sendOnHold))
                    .nextRunAt(now)
                    .updatedAt(now)
                    .build();
        } else {
            merged = Schedule.builder()
                    .userId(userId)
                    .layoutId(layoutId)
                    .enabled(orElse(request.getEnabled(), true))
                    .frequency(frequency == null ? DEFAULT_FREQUENCY : frequency)
                    .sendToTelegram(orElse(request.getSendToTelegram(), true))
                    .onlyOnSignalChange(orElse(request.getOnlyOnSignalChange(), false))
                    .minConfidence(minConfidence == null ? DEFAULT_MIN_CONFIDENCE : minConfidence)
                    .sendOnHold(orElse(request.getSendOnHold(), false))
                    .nextRunAt(now)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        }
        Schedule saved = schedules.save(merged);
        LOG.info("schedule saved schedule_id={} layout_id={} frequency={} enabled={} created={}",
                saved.id, saved.layoutId, saved.frequency.label(), saved.enabled, existing.isEmpty());
        return saved;
    }

    public TriggerResult triggerNow(long scheduleId) throws ScheduleNotFoundException, PersistenceException {
        return loop.triggerNow(scheduleId);
    }

    /**
     * Newest first, scoped to schedules the user owns.
     */
    public List<JobLog> listLogs(String userId, Long scheduleId, int limit) throws ValidationException, PersistenceException {
        if (isBlank(userId)) {
            throw new ValidationException("userId is required");
        }
        return jobLogs.listForUser(userId, scheduleId, clampLimit(limit));
    }

    public List<Schedule> listSchedules(String userId) throws ValidationException, PersistenceException {
        if (isBlank(userId)) {
            throw new ValidationException("userId is required");
        }
        return schedules.findByUser(userId);
    }

    static int clampLimit(int limit) {
        if (limit <= 0) {
            return DEFAULT_LOG_LIMIT;
        }
        return Math.min(limit, MAX_LOG_LIMIT);
    }

    private static boolean orElse(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
