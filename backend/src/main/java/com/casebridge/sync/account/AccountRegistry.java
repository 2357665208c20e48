package com.casebridge.sync.account;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Accounts loaded from configuration. Immutable after startup.
 */
@Component
public class AccountRegistry {

    private static final Logger log = LoggerFactory.getLogger(AccountRegistry.class);

    private final Map<String, Account> accounts;

    public AccountRegistry(AccountProperties properties) {
        var byKey = new LinkedHashMap<String, Account>();
        for (var entry : properties.accounts()) {
            if (entry == null || entry.key() == null || entry.key().isBlank()) {
                throw new IllegalStateException("account_key_required");
            }
            if (entry.roleArn() == null || entry.roleArn().isBlank()) {
                throw new IllegalStateException("account_role_arn_required key=" + entry.key());
            }
            var key = entry.key().trim();
            var displayName = entry.displayName() == null || entry.displayName().isBlank() ? key : entry.displayName().trim();
            var previous = byKey.put(key, new Account(key, entry.roleArn().trim(), displayName, entry.externalId()));
            if (previous != null) {
                throw new IllegalStateException("account_key_duplicated key=" + key);
            }
        }
        this.accounts = Collections.unmodifiableMap(byKey);
        log.info("accounts_loaded count={}", accounts.size());
    }

    public Optional<Account> find(String accountKey) {
        if (accountKey == null) return Optional.empty();
        return Optional.ofNullable(accounts.get(accountKey));
    }

    public Account require(String accountKey) {
        return find(accountKey).orElseThrow(() -> new AccountNotFoundException(accountKey));
    }

    public boolean exists(String accountKey) {
        return accountKey != null && accounts.containsKey(accountKey);
    }

    public List<Account> list() {
        return List.copyOf(accounts.values());
    }
}
