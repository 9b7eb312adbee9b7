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
public class JobLogRow {
    private Long id;
    private long scheduleId;
    private String triggerType;
    private OffsetDateTime startedAt;
    private OffsetDateTime finishedAt;
    private String status;
    private Long signalId;
    private String action;
    private Integer confidence;
    private String decisionReason;
    private boolean telegramSent;
    private String error;
    private long durationMs;
}
