package com.casebridge.sync.ingest.service;

import com.casebridge.sync.account.AccountRegistry;
import com.casebridge.sync.backend.BackendCallException;
import com.casebridge.sync.backend.CaseBackend;
import com.casebridge.sync.backend.RemoteCase;
import com.casebridge.sync.cases.model.CaseStatus;
import com.casebridge.sync.cases.model.DedupKeys;
import com.casebridge.sync.cases.model.TransitionResult;
import com.casebridge.sync.cases.model.TransitionSource;
import com.casebridge.sync.cases.service.CaseRegistryService;
import com.casebridge.sync.cases.service.CommunicationRelayService;
import com.casebridge.sync.common.config.SyncProperties;
import com.casebridge.sync.credential.CredentialBroker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Turns push-delivered case events into proposed transitions.
 *
 * Events are neither buffered nor reordered: edge validation in the registry absorbs reordering, and dedup keys
 * absorb redelivery. Transient upstream failures propagate so the transport redelivers the event.
 */
@Service
public class NotificationIngestService {

    private static final Logger log = LoggerFactory.getLogger(NotificationIngestService.class);

    private final AccountRegistry accountRegistry;
    private final CaseRegistryService registry;
    private final CommunicationRelayService relayService;
    private final CredentialBroker credentialBroker;
    private final CaseBackend caseBackend;
    private final Clock clock;
    private final Duration dedupWindow;

    public NotificationIngestService(
            AccountRegistry accountRegistry,
            CaseRegistryService registry,
            CommunicationRelayService relayService,
            CredentialBroker credentialBroker,
            CaseBackend caseBackend,
            Clock clock,
            SyncProperties properties
    ) {
        this.accountRegistry = accountRegistry;
        this.registry = registry;
        this.relayService = relayService;
        this.credentialBroker = credentialBroker;
        this.caseBackend = caseBackend;
        this.clock = clock;
        this.dedupWindow = properties.dedupWindow();
    }

    public IngestOutcome ingest(CaseEvent event) {
        if (event == null || isBlank(event.accountKey()) || isBlank(event.caseId())) {
            throw new IllegalArgumentException("missing_event_fields");
        }
        accountRegistry.require(event.accountKey());

        var kind = CaseEventKind.parse(event.eventKind()).orElse(null);
        if (kind == null) {
            log.info("case_event_ignored_unknown_kind account={} case={} kind={}",
                    event.accountKey(), event.caseId(), event.eventKind());
            return IngestOutcome.ignored();
        }
        if (kind == CaseEventKind.CASE_CREATED) {
            log.debug("case_event_informational account={} case={}", event.accountKey(), event.caseId());
            return IngestOutcome.ignored();
        }

        var eventTime = event.eventTime() != null ? event.eventTime() : clock.instant();
        var implied = kind.impliedStatus();
        if (implied.isPresent()) {
            var result = apply(event, implied.get(), eventTime);
            return IngestOutcome.of(result, 0);
        }

        // COMMUNICATION_ADDED: status and new messages come from the backend.
        if (registry.lookupByCase(event.accountKey(), event.caseId()).isEmpty()) {
            log.debug("case_event_no_live_conversation account={} case={}", event.accountKey(), event.caseId());
            return IngestOutcome.of(TransitionResult.notFound(event.accountKey(), event.caseId(), null, null), 0);
        }

        var remote = readCase(event.accountKey(), event.caseId());
        if (remote == null) {
            log.warn("case_event_case_unreadable account={} case={}", event.accountKey(), event.caseId());
            return IngestOutcome.of(TransitionResult.notFound(event.accountKey(), event.caseId(), null, null), 0);
        }

        var result = apply(event, remote.status(), eventTime);
        int relayed = relayService.relay(event.accountKey(), remote);
        return IngestOutcome.of(result, relayed);
    }

    private TransitionResult apply(CaseEvent event, CaseStatus observed, Instant eventTime) {
        var dedupKey = DedupKeys.forObservation(event.accountKey(), event.caseId(), observed, eventTime, dedupWindow);
        return registry.applyTransition(event.accountKey(), event.caseId(), observed, TransitionSource.PUSH, dedupKey);
    }

    private RemoteCase readCase(String accountKey, String caseId) {
        var credential = credentialBroker.getCredential(accountKey);
        try {
            return caseBackend.describeCase(credential, caseId, true).orElse(null);
        } catch (BackendCallException e) {
            if (e.credentialRejected()) {
                credentialBroker.invalidate(accountKey, credential);
            }
            throw e;
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
