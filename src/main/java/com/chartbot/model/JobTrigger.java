package com.chartbot.model;

public enum JobTrigger {
    TICK,
    MANUAL,
    RECOVERY
}
