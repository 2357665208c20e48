package com.casebridge.sync.backend.aws;

import com.casebridge.sync.backend.BackendCallException;
import com.casebridge.sync.backend.CaseBackend;
import com.casebridge.sync.backend.RemoteCase;
import com.casebridge.sync.backend.RemoteCommunication;
import com.casebridge.sync.cases.model.CaseStatus;
import com.casebridge.sync.credential.CredentialLease;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.support.SupportClient;
import software.amazon.awssdk.services.support.model.AddCommunicationToCaseRequest;
import software.amazon.awssdk.services.support.model.CaseDetails;
import software.amazon.awssdk.services.support.model.Communication;
import software.amazon.awssdk.services.support.model.DescribeCasesRequest;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Case reads and replies through the AWS Support API, one short-lived client per call sharing the pooled HTTP client.
 */
public class AwsSupportCaseBackend implements CaseBackend {

    private static final int MAX_IDS_PER_CALL = 100;

    private static final Set<String> REJECTED_CREDENTIAL_CODES = Set.of(
            "ExpiredToken",
            "ExpiredTokenException",
            "InvalidClientTokenId",
            "UnrecognizedClientException",
            "AccessDeniedException"
    );

    private final AwsProperties props;
    private final SdkHttpClient httpClient;

    public AwsSupportCaseBackend(AwsProperties props, SdkHttpClient httpClient) {
        this.props = props;
        this.httpClient = httpClient;
    }

    @Override
    public List<RemoteCase> describeCases(CredentialLease credential, List<String> caseIds, boolean includeCommunications) {
        if (caseIds == null || caseIds.isEmpty()) return List.of();
        if (caseIds.size() > MAX_IDS_PER_CALL) {
            throw new IllegalArgumentException("too_many_case_ids");
        }

        var request = DescribeCasesRequest.builder()
                .caseIdList(caseIds)
                .includeResolvedCases(true)
                .includeCommunications(includeCommunications)
                .build();

        try (var client = buildClient(credential)) {
            var result = new ArrayList<RemoteCase>();
            for (var details : client.describeCasesPaginator(request).cases()) {
                result.add(toRemoteCase(details));
            }
            return result;
        } catch (SdkException e) {
            throw translate("describe_cases_failed", e);
        }
    }

    @Override
    public void addCommunication(CredentialLease credential, String caseId, String body) {
        var request = AddCommunicationToCaseRequest.builder()
                .caseId(caseId)
                .communicationBody(body)
                .build();

        try (var client = buildClient(credential)) {
            var response = client.addCommunicationToCase(request);
            if (!Boolean.TRUE.equals(response.result())) {
                throw new BackendCallException("add_communication_not_accepted", false, null);
            }
        } catch (SdkException e) {
            throw translate("add_communication_failed", e);
        }
    }

    static BackendCallException translate(String operation, SdkException e) {
        if (e instanceof AwsServiceException ase) {
            var code = ase.awsErrorDetails() == null ? null : ase.awsErrorDetails().errorCode();
            var rejected = ase.statusCode() == 403 || (code != null && REJECTED_CREDENTIAL_CODES.contains(code));
            return new BackendCallException(operation + " code=" + code, rejected, e);
        }
        return new BackendCallException(operation, false, e);
    }

    private SupportClient buildClient(CredentialLease credential) {
        var session = AwsSessionCredentials.create(
                credential.accessKeyId(),
                credential.secretAccessKey(),
                credential.sessionToken()
        );
        return SupportClient.builder()
                .region(Region.of(props.supportRegion()))
                .credentialsProvider(StaticCredentialsProvider.create(session))
                .httpClient(httpClient)
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(props.apiCallTimeout())
                        .build())
                .build();
    }

    static RemoteCase toRemoteCase(CaseDetails details) {
        var communications = new ArrayList<RemoteCommunication>();
        if (details.recentCommunications() != null && details.recentCommunications().communications() != null) {
            for (Communication c : details.recentCommunications().communications()) {
                var created = parseTime(c.timeCreated());
                if (created == null) continue;
                communications.add(new RemoteCommunication(c.body(), c.submittedBy(), created));
            }
        }
        return new RemoteCase(
                details.caseId(),
                details.displayId(),
                details.status(),
                CaseStatus.fromBackend(details.status()),
                communications
        );
    }

    static Instant parseTime(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(value.trim());
            } catch (DateTimeParseException ignored) {
                return null;
            }
        }
    }
}
