package com.casebridge.sync.notify.service;

import com.casebridge.sync.backend.RemoteCommunication;
import com.casebridge.sync.cases.model.CaseStatus;

import java.time.Duration;

/**
 * Turns transitions and scheduler actions into chat text. Output must depend only on the arguments,
 * so that a retry re-sends identical content.
 */
public interface MessageRenderer {

    String statusChanged(RenderContext context, CaseStatus before, CaseStatus after);

    String communication(RenderContext context, RemoteCommunication communication);

    String archiveWarning(RenderContext context, Duration remaining);

    String archived(RenderContext context, String reason);
}
