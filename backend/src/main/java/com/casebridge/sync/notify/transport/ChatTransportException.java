package com.casebridge.sync.notify.transport;

public class ChatTransportException extends RuntimeException {

    public ChatTransportException(String message) {
        super(message);
    }

    public ChatTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
