package com.chartbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRow {
    private Long id;
    private String userId;
    private String layoutId;
    private boolean enabled;
    private String frequency;
    private boolean sendToTelegram;
    private boolean onlyOnSignalChange;
    private int minConfidence;
    private boolean sendOnHold;
    private OffsetDateTime nextRunAt;
    private String lastSignal;
    private OffsetDateTime lastRunAt;
    private OffsetDateTime inFlightUntil;
    private OffsetDateTime claimedAt;
    private OffsetDateTime createdAt;
    private OffsetDateTime updatedAt;
}
