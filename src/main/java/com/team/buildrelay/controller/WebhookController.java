package com.team.buildrelay.controller;

import com.team.buildrelay.model.RelayOutcome;
import com.team.buildrelay.model.dto.BuildkiteWebhookPayload;
import com.team.buildrelay.service.relay.WebhookRelayService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST Controller for receiving Buildkite webhooks.
 *
 * Buildkite Webhook Configuration:
 * 1. Go to Organization Settings → Notification Services → Add → Webhook
 * 2. Webhook URL: https://your-relay.example.com/webhook
 * 3. Events: build.*, job.finished, agent.*, annotation.*, pipeline.*
 */
@RestController
@Slf4j
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookRelayService webhookRelayService;

    /**
     * Receive a Buildkite event and forward it to Zulip.
     *
     * Responds once delivery finished, so Buildkite sees a 500 when Zulip
     * rejected the message. Filtered events answer 200 with "Filtered".
     */
    @PostMapping("/webhook")
    public Mono<ResponseEntity<Map<String, String>>> handleWebhook(@RequestBody BuildkiteWebhookPayload payload) {
        log.info("Received webhook: event={}, build={}, pipeline={}",
                payload.getEvent(),
                payload.getBuildInfo() != null ? payload.getBuildInfo().getNumber() : "null",
                payload.getPipeline() != null ? payload.getPipeline().getName() : "null");

        if (payload.getEvent() == null || payload.getEvent().isBlank()) {
            log.warn("Received webhook with no event type");
            return Mono.just(ResponseEntity.badRequest().body(Map.of("error", "Missing event type")));
        }

        return webhookRelayService.relay(payload)
                .map(outcome -> ResponseEntity.ok(Map.of("message",
                        outcome.getStatus() == RelayOutcome.Status.FILTERED ? "Filtered" : "OK")))
                .onErrorResume(e -> Mono.just(ResponseEntity.internalServerError()
                        .body(Map.of("error", "Failed to deliver message"))));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP", "service", "build-relay"));
    }
}
