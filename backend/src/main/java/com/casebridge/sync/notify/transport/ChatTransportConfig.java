package com.casebridge.sync.notify.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ChatTransportConfig {

    private static final Logger log = LoggerFactory.getLogger(ChatTransportConfig.class);

    @Bean
    public ChatTransport chatTransport(LarkProperties props, RestTemplateBuilder restTemplateBuilder, Clock clock) {
        if (!props.enabled()) {
            log.info("chat_transport mode=logging");
            return new LoggingChatTransport();
        }
        if (props.appId() == null || props.appId().isBlank() || props.appSecret() == null || props.appSecret().isBlank()) {
            throw new IllegalStateException("lark_credentials_required");
        }
        var restTemplate = restTemplateBuilder
                .rootUri(props.baseUrl())
                .setConnectTimeout(props.connectTimeout())
                .setReadTimeout(props.readTimeout())
                .build();
        log.info("chat_transport mode=lark baseUrl={}", props.baseUrl());
        return new LarkChatTransport(restTemplate, props, clock);
    }
}
