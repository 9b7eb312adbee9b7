package com.chartbot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "telegram")
public class TelegramProperties {
    private String botToken = "";
    private boolean errorAlerts = true;
    private String apiBaseUrl = "https://api.telegram.org";
    private int requestTimeoutSeconds = 30;
}
