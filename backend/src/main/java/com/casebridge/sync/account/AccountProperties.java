package com.casebridge.sync.account;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "app")
public record AccountProperties(List<Entry> accounts) {

    public AccountProperties {
        accounts = accounts == null ? List.of() : List.copyOf(accounts);
    }

    public record Entry(String key, String roleArn, String displayName, String externalId) {
    }
}
