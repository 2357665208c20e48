package com.casebridge.sync.backend.aws;

import com.casebridge.sync.backend.CaseBackend;
import com.casebridge.sync.credential.IdentityExchange;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.http.SdkHttpClient;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClient;

import java.time.Clock;

@Configuration
@ConditionalOnProperty(prefix = "app.aws", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AwsClientConfig {

    @Bean(destroyMethod = "close")
    public SdkHttpClient awsHttpClient(AwsProperties props) {
        return ApacheHttpClient.builder()
                .connectionTimeout(props.apiCallTimeout())
                .socketTimeout(props.apiCallTimeout())
                .maxConnections(50)
                .build();
    }

    /**
     * STS client running as the service's own identity; every account credential is derived from it.
     */
    @Bean(destroyMethod = "close")
    public StsClient stsClient(AwsProperties props, SdkHttpClient awsHttpClient) {
        return StsClient.builder()
                .region(Region.of(props.stsRegion()))
                .credentialsProvider(DefaultCredentialsProvider.create())
                .httpClient(awsHttpClient)
                .overrideConfiguration(ClientOverrideConfiguration.builder()
                        .apiCallTimeout(props.apiCallTimeout())
                        .build())
                .build();
    }

    @Bean
    public IdentityExchange stsIdentityExchange(StsClient stsClient, AwsProperties props, Clock clock) {
        return new StsIdentityExchange(stsClient, props, clock);
    }

    @Bean
    public CaseBackend awsSupportCaseBackend(AwsProperties props, SdkHttpClient awsHttpClient) {
        return new AwsSupportCaseBackend(props, awsHttpClient);
    }
}
