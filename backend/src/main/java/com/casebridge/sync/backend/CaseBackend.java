package com.casebridge.sync.backend;

import com.casebridge.sync.credential.CredentialLease;

import java.util.List;
import java.util.Optional;

/**
 * The remote ticketing backend: case reads plus replies posted back to a case.
 */
public interface CaseBackend {

    /**
     * Reads the given cases (at most 100 ids) under {@code credential}. Unknown ids are absent from the result.
     *
     * @throws BackendCallException on timeout, throttling, 5xx or a rejected credential
     */
    List<RemoteCase> describeCases(CredentialLease credential, List<String> caseIds, boolean includeCommunications);

    /**
     * Appends {@code body} to the case's communication thread.
     *
     * @throws BackendCallException on timeout, throttling, 5xx or a rejected credential
     */
    void addCommunication(CredentialLease credential, String caseId, String body);

    default Optional<RemoteCase> describeCase(CredentialLease credential, String caseId, boolean includeCommunications) {
        return describeCases(credential, List.of(caseId), includeCommunications).stream()
                .filter(c -> caseId.equals(c.caseId()))
                .findFirst();
    }
}
