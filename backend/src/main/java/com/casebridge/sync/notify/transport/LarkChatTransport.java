package com.casebridge.sync.notify.transport;

import com.casebridge.sync.notify.DispatchKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chat transport over the Lark open API. Conversation ids are Lark chat ids.
 */
public class LarkChatTransport implements ChatTransport {

    private static final Logger log = LoggerFactory.getLogger(LarkChatTransport.class);

    static final String TOKEN_PATH = "/open-apis/auth/v3/tenant_access_token/internal";
    static final String MESSAGES_PATH = "/open-apis/im/v1/messages?receive_id_type=chat_id";
    static final String CHAT_PATH = "/open-apis/im/v1/chats/{chatId}";

    private static final Duration TOKEN_REFRESH_MARGIN = Duration.ofSeconds(60);
    private static final int MAX_UUID_LENGTH = 50;
    // Lark: the chat does not exist or the bot is no longer in it.
    private static final int CODE_CHAT_NOT_FOUND = 232010;

    private final RestTemplate restTemplate;
    private final LarkProperties props;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Object tokenLock = new Object();
    private volatile String tenantToken;
    private volatile Instant tenantTokenRefreshAt = Instant.EPOCH;

    public LarkChatTransport(RestTemplate restTemplate, LarkProperties props, Clock clock) {
        this.restTemplate = restTemplate;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public void deliver(OutboundMessage message) {
        sendText(message);
        if (message.kind() == DispatchKind.ARCHIVE) {
            dissolveChat(message.conversationId());
        }
    }

    private void sendText(OutboundMessage message) {
        var body = new LinkedHashMap<String, Object>();
        body.put("receive_id", message.conversationId());
        body.put("msg_type", "text");
        body.put("content", toJson(Map.of("text", message.text() == null ? "" : message.text())));
        body.put("uuid", uuidFor(message.dispatchId()));

        JsonNode response;
        try {
            response = restTemplate.postForObject(MESSAGES_PATH, new HttpEntity<>(body, authorizedHeaders()), JsonNode.class);
        } catch (RestClientException e) {
            throw new ChatTransportException("lark_send_failed", e);
        }
        var code = responseCode(response);
        if (code == CODE_CHAT_NOT_FOUND && message.kind() == DispatchKind.ARCHIVE) {
            log.info("lark_chat_already_gone chatId={} dispatchId={}", message.conversationId(), message.dispatchId());
            return;
        }
        if (code != 0) {
            throw new ChatTransportException("lark_send_rejected code=" + code + " msg=" + responseMessage(response));
        }
    }

    private void dissolveChat(String chatId) {
        JsonNode response;
        try {
            response = restTemplate.exchange(
                    CHAT_PATH,
                    HttpMethod.DELETE,
                    new HttpEntity<>(authorizedHeaders()),
                    JsonNode.class,
                    chatId
            ).getBody();
        } catch (HttpClientErrorException e) {
            if (e.getStatusCode() == HttpStatus.NOT_FOUND) {
                log.info("lark_chat_already_gone chatId={}", chatId);
                return;
            }
            throw new ChatTransportException("lark_dissolve_failed", e);
        } catch (RestClientException e) {
            throw new ChatTransportException("lark_dissolve_failed", e);
        }
        var code = responseCode(response);
        if (code == CODE_CHAT_NOT_FOUND) {
            log.info("lark_chat_already_gone chatId={}", chatId);
            return;
        }
        if (code != 0) {
            throw new ChatTransportException("lark_dissolve_rejected code=" + code + " msg=" + responseMessage(response));
        }
        log.info("lark_chat_dissolved chatId={}", chatId);
    }

    private HttpHeaders authorizedHeaders() {
        var headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setBearerAuth(tenantAccessToken());
        return headers;
    }

    String tenantAccessToken() {
        var now = clock.instant();
        var token = tenantToken;
        if (token != null && now.isBefore(tenantTokenRefreshAt)) {
            return token;
        }
        synchronized (tokenLock) {
            if (tenantToken != null && clock.instant().isBefore(tenantTokenRefreshAt)) {
                return tenantToken;
            }
            var body = Map.of("app_id", props.appId(), "app_secret", props.appSecret());
            var headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            JsonNode response;
            try {
                response = restTemplate.postForObject(TOKEN_PATH, new HttpEntity<>(body, headers), JsonNode.class);
            } catch (RestClientException e) {
                throw new ChatTransportException("lark_token_failed", e);
            }
            if (responseCode(response) != 0 || !response.hasNonNull("tenant_access_token")) {
                throw new ChatTransportException("lark_token_rejected msg=" + responseMessage(response));
            }
            long expireSeconds = response.path("expire").asLong(7200);
            tenantToken = response.get("tenant_access_token").asText();
            tenantTokenRefreshAt = clock.instant().plusSeconds(expireSeconds).minus(TOKEN_REFRESH_MARGIN);
            return tenantToken;
        }
    }

    static String uuidFor(String dispatchId) {
        if (dispatchId == null) return null;
        return dispatchId.length() <= MAX_UUID_LENGTH ? dispatchId : dispatchId.substring(0, MAX_UUID_LENGTH);
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (Exception e) {
            throw new ChatTransportException("lark_payload_encode_failed", e);
        }
    }

    private static int responseCode(JsonNode response) {
        if (response == null) return -1;
        return response.path("code").asInt(-1);
    }

    private static String responseMessage(JsonNode response) {
        return response == null ? "empty_response" : response.path("msg").asText("");
    }
}
