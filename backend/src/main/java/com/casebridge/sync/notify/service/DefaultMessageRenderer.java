package com.casebridge.sync.notify.service;

import com.casebridge.sync.backend.RemoteCommunication;
import com.casebridge.sync.cases.model.CaseStatus;
import com.casebridge.sync.common.config.SyncProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

@Component
public class DefaultMessageRenderer implements MessageRenderer {

    static final String CONSOLE_CASE_URL = "https://support.console.aws.amazon.com/support/home#/case/?displayId=";
    static final int MAX_BODY_CHARS = 8000;

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'")
            .withZone(ZoneOffset.UTC);

    private final SyncProperties properties;

    public DefaultMessageRenderer(SyncProperties properties) {
        this.properties = properties;
    }

    @Override
    public String statusChanged(RenderContext context, CaseStatus before, CaseStatus after) {
        var sb = new StringBuilder();
        sb.append("Case status updated\n");
        sb.append("Case: ").append(context.caseLabel()).append('\n');
        sb.append("Status: ").append(label(before)).append(" -> ").append(label(after)).append('\n');
        if (after == CaseStatus.RESOLVED) {
            sb.append("This conversation will be archived automatically in ")
                    .append(properties.gracePeriod().toHours())
                    .append(" hours unless the case is reopened.\n");
        }
        sb.append(consoleLink(context));
        return sb.toString();
    }

    @Override
    public String communication(RenderContext context, RemoteCommunication communication) {
        var body = communication.body() == null ? "" : communication.body();
        if (body.length() > MAX_BODY_CHARS) {
            body = body.substring(0, MAX_BODY_CHARS) + "\n... (message truncated, see the support console for the full text)";
        }
        var sb = new StringBuilder();
        sb.append("New reply on case ").append(context.caseLabel()).append('\n');
        sb.append("From: ").append(senderLabel(communication.submittedBy()));
        if (communication.timeCreated() != null) {
            sb.append(" at ").append(TIME_FORMAT.format(communication.timeCreated()));
        }
        sb.append("\n\n").append(body).append('\n');
        sb.append(consoleLink(context));
        return sb.toString();
    }

    @Override
    public String archiveWarning(RenderContext context, Duration remaining) {
        long minutes = Math.max(1, remaining.toMinutes());
        return "Case " + context.caseLabel() + " is resolved. This conversation will be archived in "
                + minutes + " minutes unless the case is reopened.\n" + consoleLink(context);
    }

    @Override
    public String archived(RenderContext context, String reason) {
        if ("requested".equals(reason)) {
            return "This conversation was archived at the creator's request. Case " + context.caseLabel()
                    + " still exists in the support console.\n" + consoleLink(context);
        }
        return "Case " + context.caseLabel() + " has been resolved for over " + properties.gracePeriod().toHours()
                + " hours; this conversation is now archived. The case still exists in the support console.\n"
                + consoleLink(context);
    }

    private static String consoleLink(RenderContext context) {
        return CONSOLE_CASE_URL + context.caseLabel();
    }

    private static String senderLabel(String submittedBy) {
        if (submittedBy == null || submittedBy.isBlank()) return "Unknown";
        if (submittedBy.toLowerCase(Locale.ROOT).contains("amazon")) return "AWS Support";
        return submittedBy;
    }

    private static String label(CaseStatus status) {
        if (status == null) return "Unknown";
        return switch (status) {
            case OPEN -> "Open";
            case PENDING -> "Pending";
            case RESOLVED -> "Resolved";
            case REOPENED -> "Reopened";
        };
    }
}
