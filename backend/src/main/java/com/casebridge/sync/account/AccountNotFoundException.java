package com.casebridge.sync.account;

public class AccountNotFoundException extends RuntimeException {

    private final String accountKey;

    public AccountNotFoundException(String accountKey) {
        super("account_not_found");
        this.accountKey = accountKey;
    }

    public String accountKey() {
        return accountKey;
    }
}
