package com.casebridge.sync.backend;

import java.time.Instant;

public record RemoteCommunication(String body, String submittedBy, Instant timeCreated) {
}
