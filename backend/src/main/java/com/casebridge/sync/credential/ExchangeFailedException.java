package com.casebridge.sync.credential;

import com.casebridge.sync.common.error.TransientUpstreamException;

public class ExchangeFailedException extends TransientUpstreamException {

    private final String accountKey;

    public ExchangeFailedException(String accountKey, String message) {
        super(message);
        this.accountKey = accountKey;
    }

    public ExchangeFailedException(String accountKey, String message, Throwable cause) {
        super(message, cause);
        this.accountKey = accountKey;
    }

    public String accountKey() {
        return accountKey;
    }
}
