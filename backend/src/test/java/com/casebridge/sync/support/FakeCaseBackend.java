package com.casebridge.sync.support;

import com.casebridge.sync.backend.BackendCallException;
import com.casebridge.sync.backend.CaseBackend;
import com.casebridge.sync.backend.RemoteCase;
import com.casebridge.sync.backend.RemoteCommunication;
import com.casebridge.sync.cases.model.CaseStatus;
import com.casebridge.sync.credential.CredentialLease;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

public class FakeCaseBackend implements CaseBackend {

    public record PostedCommunication(String accountKey, String caseId, String body) {
    }

    private final ConcurrentHashMap<String, RemoteCase> cases = new ConcurrentHashMap<>();
    private final Set<String> failingAccounts = ConcurrentHashMap.newKeySet();
    private final Set<String> rejectOnceAccounts = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<String, CountDownLatch> blockedAccounts = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<PostedCommunication> posted = new CopyOnWriteArrayList<>();
    private final AtomicInteger calls = new AtomicInteger();

    @Override
    public List<RemoteCase> describeCases(CredentialLease credential, List<String> caseIds, boolean includeCommunications) {
        calls.incrementAndGet();
        var accountKey = credential.accountKey();
        awaitRelease(accountKey);
        failIfInjected(accountKey);
        var result = new ArrayList<RemoteCase>();
        for (var id : caseIds) {
            var c = cases.get(key(accountKey, id));
            if (c == null) continue;
            result.add(includeCommunications ? c : new RemoteCase(c.caseId(), c.displayId(), c.backendStatus(), c.status(), List.of()));
        }
        return result;
    }

    @Override
    public void addCommunication(CredentialLease credential, String caseId, String body) {
        calls.incrementAndGet();
        failIfInjected(credential.accountKey());
        posted.add(new PostedCommunication(credential.accountKey(), caseId, body));
    }

    public void put(String accountKey, String caseId, CaseStatus status) {
        put(accountKey, caseId, status, List.of());
    }

    public void put(String accountKey, String caseId, CaseStatus status, List<RemoteCommunication> communications) {
        cases.put(key(accountKey, caseId), new RemoteCase(caseId, "D-" + caseId, status.name().toLowerCase(), status, communications));
    }

    public void failFor(String accountKey) {
        failingAccounts.add(accountKey);
    }

    public void rejectCredentialOnce(String accountKey) {
        rejectOnceAccounts.add(accountKey);
    }

    /**
     * Calls for the account hang until {@code release} opens or the thread is interrupted.
     */
    public void blockFor(String accountKey, CountDownLatch release) {
        blockedAccounts.put(accountKey, release);
    }

    public List<PostedCommunication> posted() {
        return List.copyOf(posted);
    }

    public int calls() {
        return calls.get();
    }

    public void reset() {
        cases.clear();
        failingAccounts.clear();
        rejectOnceAccounts.clear();
        blockedAccounts.clear();
        posted.clear();
        calls.set(0);
    }

    private void awaitRelease(String accountKey) {
        var release = blockedAccounts.get(accountKey);
        if (release == null) return;
        try {
            if (!release.await(30, TimeUnit.SECONDS)) {
                throw new BackendCallException("injected_hang_not_released", false, null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendCallException("injected_hang_interrupted", false, e);
        }
    }

    private void failIfInjected(String accountKey) {
        if (failingAccounts.contains(accountKey)) {
            throw new BackendCallException("injected_backend_failure", false, null);
        }
        if (rejectOnceAccounts.remove(accountKey)) {
            throw new BackendCallException("injected_expired_token", true, null);
        }
    }

    private static String key(String accountKey, String caseId) {
        return accountKey + "|" + caseId;
    }
}
