package com.chartbot.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccountRow {
    private String id;
    private String tvSessionId;
    private String tvSessionIdSign;
    private String telegramChatId;
    private Boolean telegramIncludeChart;
    private Boolean telegramIncludeEconomic;
    private String preferredModel;
}
