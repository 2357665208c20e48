package com.casebridge.sync.backend.aws;

import com.casebridge.sync.account.Account;
import com.casebridge.sync.credential.CredentialLease;
import com.casebridge.sync.credential.ExchangeFailedException;
import com.casebridge.sync.credential.IdentityExchange;
import software.amazon.awssdk.awscore.AwsRequestOverrideConfiguration;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;

import java.time.Clock;
import java.time.Duration;

public class StsIdentityExchange implements IdentityExchange {

    private final StsClient stsClient;
    private final AwsProperties props;
    private final Clock clock;

    public StsIdentityExchange(StsClient stsClient, AwsProperties props, Clock clock) {
        this.stsClient = stsClient;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public CredentialLease exchange(Account account, Duration timeout) {
        var builder = AssumeRoleRequest.builder()
                .roleArn(account.roleArn())
                .roleSessionName(props.roleSessionName())
                .durationSeconds((int) props.leaseDuration().toSeconds())
                .overrideConfiguration(AwsRequestOverrideConfiguration.builder()
                        .apiCallTimeout(timeout)
                        .build());
        if (account.externalId() != null && !account.externalId().isBlank()) {
            builder.externalId(account.externalId());
        }

        try {
            var issuedAt = clock.instant();
            var credentials = stsClient.assumeRole(builder.build()).credentials();
            if (credentials == null) {
                throw new ExchangeFailedException(account.key(), "assume_role_returned_no_credentials");
            }
            return new CredentialLease(
                    account.key(),
                    credentials.accessKeyId(),
                    credentials.secretAccessKey(),
                    credentials.sessionToken(),
                    issuedAt,
                    credentials.expiration()
            );
        } catch (SdkException e) {
            throw new ExchangeFailedException(account.key(), "assume_role_failed", e);
        }
    }
}
