package com.casebridge.sync.account;

/**
 * A credential scope: one backend tenant reached by assuming {@code roleArn}.
 */
public record Account(String key, String roleArn, String displayName, String externalId) {
}
