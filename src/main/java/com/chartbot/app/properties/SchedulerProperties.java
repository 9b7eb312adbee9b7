package com.chartbot.app.properties;

import com.chartbot.automation.SchedulerSettings;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Getter
@Setter
@ConfigurationProperties(prefix = "scheduler")
public class SchedulerProperties {
    private int tickSeconds = 300;
    private int jobParallelism = 4;
    private int captureConcurrency = 2;
    private int captureTimeoutSeconds = 45;
    private int analysisTimeoutSeconds = 120;
    private int enrichmentTimeoutSeconds = 30;
    private int jobTimeoutSeconds = 300;
    private int shutdownGraceSeconds = 60;

    public SchedulerSettings toSettings() {
        return SchedulerSettings.builder()
                .tick(Duration.ofSeconds(tickSeconds))
                .jobParallelism(jobParallelism)
                .captureConcurrency(captureConcurrency)
                .captureTimeout(Duration.ofSeconds(captureTimeoutSeconds))
                .analysisTimeout(Duration.ofSeconds(analysisTimeoutSeconds))
                .enrichmentTimeout(Duration.ofSeconds(enrichmentTimeoutSeconds))
                .jobTimeout(Duration.ofSeconds(jobTimeoutSeconds))
                .shutdownGrace(Duration.ofSeconds(shutdownGraceSeconds))
                .build()
                .validate();
    }
}
