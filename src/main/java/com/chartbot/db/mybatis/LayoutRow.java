package com.chartbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LayoutRow {
    private String id;
    private String userId;
    private String captureTargetId;
    private String symbol;
    private String chartInterval;
}
