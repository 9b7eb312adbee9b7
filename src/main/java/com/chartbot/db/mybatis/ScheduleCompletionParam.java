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
public class ScheduleCompletionParam {
    private long scheduleId;
    private OffsetDateTime nextRunAt;
    private OffsetDateTime lastRunAt;
    private String lastSignal;
}
