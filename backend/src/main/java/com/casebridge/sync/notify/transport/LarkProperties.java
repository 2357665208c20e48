package com.casebridge.sync.notify.transport;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.chat.lark")
public record LarkProperties(
        boolean enabled,
        String baseUrl,
        String appId,
        String appSecret,
        Duration connectTimeout,
        Duration readTimeout
) {
    public LarkProperties {
        baseUrl = baseUrl == null || baseUrl.isBlank() ? "https://open.larksuite.com" : baseUrl.replaceAll("/+$", "");
        connectTimeout = connectTimeout == null ? Duration.ofSeconds(5) : connectTimeout;
        readTimeout = readTimeout == null ? Duration.ofSeconds(10) : readTimeout;
    }
}
