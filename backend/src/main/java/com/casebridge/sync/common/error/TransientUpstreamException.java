package com.casebridge.sync.common.error;

/**
 * An upstream call failed in a way the caller's own schedule should retry (next poll cycle, transport redelivery).
 */
public class TransientUpstreamException extends RuntimeException {

    public TransientUpstreamException(String message) {
        super(message);
    }

    public TransientUpstreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
