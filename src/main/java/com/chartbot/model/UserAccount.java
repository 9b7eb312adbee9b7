package com.chartbot.model;

/**
 * Read-only view of the account fields automation needs. Session values are stored encoded.
 */
public final class UserAccount {
    public final String id;
    public final String storedSessionId;
    public final String storedSessionIdSign;
    public final String telegramChatId;
    public final boolean includeChart;
    public final boolean includeEconomic;
    public final String preferredModel;

    public UserAccount(
            String id,
            String storedSessionId,
            String storedSessionIdSign,
            String telegramChatId,
            boolean includeChart,
            boolean includeEconomic,
            String preferredModel
    ) {
        this.id = id;
        this.storedSessionId = storedSessionId;
        this.storedSessionIdSign = storedSessionIdSign;
        this.telegramChatId = telegramChatId;
        this.includeChart = includeChart;
        this.includeEconomic = includeEconomic;
        this.preferredModel = preferredModel;
    }
}
