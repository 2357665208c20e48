package com.casebridge.sync.backend;

import com.casebridge.sync.common.error.TransientUpstreamException;

public class BackendCallException extends TransientUpstreamException {

    private final boolean credentialRejected;

    public BackendCallException(String message, boolean credentialRejected, Throwable cause) {
        super(message, cause);
        this.credentialRejected = credentialRejected;
    }

    /**
     * True when the backend refused the credential itself (expired or revoked), so the lease should be dropped.
     */
    public boolean credentialRejected() {
        return credentialRejected;
    }
}
