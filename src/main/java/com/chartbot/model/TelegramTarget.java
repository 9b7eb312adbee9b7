package com.chartbot.model;

public final class TelegramTarget {
    public final String chatId;
    public final boolean includeChart;
    public final boolean includeEconomic;

    public TelegramTarget(String chatId, boolean includeChart, boolean includeEconomic) {
        this.chatId = chatId;
        this.includeChart = includeChart;
        this.includeEconomic = includeEconomic;
    }
}
