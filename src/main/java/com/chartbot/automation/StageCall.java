package com.chartbot.automation;

import com.chartbot.automation.error.AutomationException;

@FunctionalInterface
interface StageCall<T> {
    T call() throws AutomationException;
}
