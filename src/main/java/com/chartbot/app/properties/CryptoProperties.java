package com.chartbot.app.properties;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "crypto")
public class CryptoProperties {
    /**
     * AES-256 key as 64 hex characters. Blank leaves stored credentials readable only as legacy plaintext.
     */
    private String encryptionKey = "";
}
