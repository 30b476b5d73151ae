package com.team.buildrelay.service.testevents;

import com.team.buildrelay.model.dto.BuildkiteWebhookPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Posts synthetic Buildkite payloads to a running relay's webhook endpoint.
 * A rejected event is logged and the remaining events are still sent.
 */
@Service
@Slf4j
public class TestEventSender {

    private final WebClient webClient;

    public TestEventSender(WebClient.Builder webClientBuilder) {
        this.webClient = webClientBuilder.build();
    }

    /**
     * Send events in order, pausing {@code delay} between consecutive events.
     *
     * @return number of events the relay accepted with a 2xx response
     */
    public Mono<Long> send(String serverUrl, List<BuildkiteWebhookPayload> events, Duration delay) {
        String webhookUrl = serverUrl + "/webhook";
        int total = events.size();

        return Flux.range(0, total)
                .concatMap(i -> {
                    Mono<Boolean> post = post(webhookUrl, events.get(i), i + 1, total);
                    if (i == 0) return post;
                    log.info("Waiting {} seconds before next event...", delay.toSeconds());
                    return Mono.delay(delay).then(post);
                })
                .filter(Boolean::booleanValue)
                .count()
                .doOnSuccess(accepted -> log.info("All test events sent! ({}/{} accepted)", accepted, total));
    }

    private Mono<Boolean> post(String webhookUrl, BuildkiteWebhookPayload event, int position, int total) {
        log.info("Sending test event {}/{}: {}", position, total, event.getEvent());

        return webClient.post()
                .uri(webhookUrl)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(event)
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.releaseBody()
                                .then(Mono.fromCallable(() -> {
                                    log.info("Event sent successfully");
                                    return true;
                                }));
                    }
                    return response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .map(body -> {
                                log.error("Failed to send event: {} - {}", response.statusCode().value(), body);
                                return false;
                            });
                });
    }
}
