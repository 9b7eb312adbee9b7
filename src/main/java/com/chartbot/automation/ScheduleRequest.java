package com.chartbot.automation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Schedule create/update input. Null fields keep the stored value, or take the default for a new schedule.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleRequest {
    private String layoutId;
    private Boolean enabled;
    private String frequency;
    private Boolean sendToTelegram;
    private Boolean onlyOnSignalChange;
    private Integer minConfidence;
    private Boolean sendOnHold;
}
