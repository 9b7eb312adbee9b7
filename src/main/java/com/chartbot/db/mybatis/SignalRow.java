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
public class SignalRow {
    private Long id;
    private String userId;
    private String layoutId;
    private String captureKey;
    private String model;
    private String action;
    private int confidence;
    private String timeframe;
    private String reasonsJson;
    private String tradeSetupJson;
    private OffsetDateTime createdAt;
}
