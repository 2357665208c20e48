package com.casebridge.sync.backend.aws;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "app.aws")
public record AwsProperties(
        boolean enabled,
        String stsRegion,
        String supportRegion,
        String roleSessionName,
        Duration leaseDuration,
        Duration apiCallTimeout
) {
    public AwsProperties {
        stsRegion = stsRegion == null || stsRegion.isBlank() ? "us-east-1" : stsRegion;
        // The Support API is only served from us-east-1.
        supportRegion = supportRegion == null || supportRegion.isBlank() ? "us-east-1" : supportRegion;
        roleSessionName = roleSessionName == null || roleSessionName.isBlank() ? "CaseBridgeSync" : roleSessionName;
        if (leaseDuration == null || leaseDuration.compareTo(Duration.ofMinutes(15)) < 0) {
            leaseDuration = leaseDuration == null ? Duration.ofHours(1) : Duration.ofMinutes(15);
        }
        if (leaseDuration.compareTo(Duration.ofHours(12)) > 0) {
            leaseDuration = Duration.ofHours(12);
        }
        apiCallTimeout = apiCallTimeout == null ? Duration.ofSeconds(10) : apiCallTimeout;
    }
}
