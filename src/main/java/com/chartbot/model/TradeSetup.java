package com.chartbot.model;

public final class TradeSetup {
    public final String quality;
    public final Double entryPrice;
    public final Double stopLoss;
    public final Double targetPrice;
    public final Double riskRewardRatio;
    public final String description;

    public TradeSetup(
            String quality,
            Double entryPrice,
            Double stopLoss,
            Double targetPrice,
            Double riskRewardRatio,
            String description
    ) {
        this.quality = quality;
        this.entryPrice = entryPrice;
        this.stopLoss = stopLoss;
        this.targetPrice = targetPrice;
        this.riskRewardRatio = riskRewardRatio;
        this.description = description;
    }

    public boolean hasLevels() {
        return entryPrice != null && stopLoss != null && targetPrice != null;
    }
}
