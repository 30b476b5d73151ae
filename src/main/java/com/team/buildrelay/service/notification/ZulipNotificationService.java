package com.team.buildrelay.service.notification;

import com.team.buildrelay.config.ZulipConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Service for posting messages to Zulip streams via the REST API.
 * Authenticates as the configured bot with HTTP basic auth.
 *
 * @see <a href="https://zulip.com/api/send-message">Zulip: send a message</a>
 */
@Service
@Slf4j
public class ZulipNotificationService {

    static final String MESSAGES_PATH = "/messages";

    private final WebClient webClient;
    private final ZulipConfig config;

    public ZulipNotificationService(@Qualifier("zulipWebClient") WebClient webClient,
                                    ZulipConfig config) {
        this.webClient = webClient;
        this.config = config;
        log.info("Zulip delivery target: {} (default stream '{}')", config.getApiBaseUrl(), config.getStream());
    }

    /**
     * Post a stream message.
     *
     * @param channel stream name
     * @param topic   topic within the stream
     * @param content message body (Zulip markdown)
     * @return completes when Zulip accepted the message; errors with
     *         {@link ZulipDeliveryException} otherwise
     */
    public Mono<Void> sendStreamMessage(String channel, String topic, String content) {
        if (config.getServerUrl() == null || config.getServerUrl().isBlank()) {
            log.error("Zulip server URL not configured. Cannot deliver message to stream '{}'", channel);
            return Mono.error(new ZulipDeliveryException("Zulip server URL not configured", null));
        }

        log.debug("Posting to Zulip stream '{}', topic '{}' ({} chars)", channel, topic, content.length());

        return webClient.post()
                .uri(MESSAGES_PATH)
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(buildForm(channel, topic, content)))
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .map(body -> new ZulipDeliveryException(response.statusCode().value(), body)))
                .bodyToMono(Void.class)
                .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                .onErrorMap(e -> !(e instanceof ZulipDeliveryException),
                        e -> new ZulipDeliveryException("Failed to send message to Zulip: " + e.getMessage(), e))
                .doOnSuccess(v -> log.debug("Successfully sent message to Zulip"))
                .doOnError(e -> log.error("Zulip delivery to stream '{}' failed: {}", channel, e.getMessage()));
    }

    MultiValueMap<String, String> buildForm(String channel, String topic, String content) {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("type", "stream");
        form.add("to", channel);
        form.add("topic", topic);
        form.add("content", content);
        return form;
    }
}
