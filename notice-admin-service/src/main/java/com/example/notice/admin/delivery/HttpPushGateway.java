package com.example.notice.admin.delivery;

import com.example.notice.shared.config.AppProperties;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Posts topic messages as JSON to an HTTP push relay: {@code POST <endpoint>/<topic>} answered by
 * {@code {"messageId": "..."}}. No retries.
 */
@Slf4j
@Component
public class HttpPushGateway implements PushGateway {

    private final WebClient webClient;
    private final Duration timeout;

    public HttpPushGateway(WebClient.Builder webClientBuilder, AppProperties appProperties) {
        AppProperties.Push push = appProperties.getPush();
        WebClient.Builder builder = webClientBuilder.clone().baseUrl(push.getEndpoint());
        if (push.getApiKey() != null && !push.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "key=" + push.getApiKey());
        }
        this.webClient = builder.build();
        this.timeout = push.getTimeout();
    }

    @Override
    public String sendToTopic(String topic, PushMessage message) {
        PushResult result = webClient.post()
                .uri("/{topic}", topic)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(message)
                .retrieve()
                .bodyToMono(PushResult.class)
                .block(timeout);
        if (result == null || result.getMessageId() == null || result.getMessageId().isBlank()) {
            throw new IllegalStateException("Push gateway returned no message id for topic " + topic);
        }
        log.debug("Push to topic {} accepted as {}", topic, result.getMessageId());
        return result.getMessageId();
    }

    @Data
    static class PushResult {
        private String messageId;
    }
}
