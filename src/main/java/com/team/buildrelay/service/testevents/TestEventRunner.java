package com.team.buildrelay.service.testevents;

import com.team.buildrelay.config.TestEventConfig;
import com.team.buildrelay.model.dto.BuildkiteWebhookPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;

/**
 * Sends the configured set of test events at startup. Only active with the
 * {@code send-test-events} profile, which also runs without the web server:
 *
 * <pre>
 * java -jar build-relay.jar --spring.profiles.active=send-test-events \
 *      --relay.test-events.event-type=scenario --relay.test-events.delay-seconds=1
 * </pre>
 */
@Component
@Profile("send-test-events")
@Slf4j
@RequiredArgsConstructor
public class TestEventRunner implements ApplicationRunner {

    private final TestEventConfig config;
    private final MockEventFactory mockEventFactory;
    private final TestEventSender testEventSender;

    @Override
    public void run(ApplicationArguments args) {
        List<BuildkiteWebhookPayload> events =
                mockEventFactory.create(config.getEventType(), config.getBuildNumber());

        log.info("Sending {} test webhook event(s) of type '{}' to {}",
                events.size(), config.getEventType(), config.getServerUrl());

        testEventSender.send(config.getServerUrl(), events, Duration.ofSeconds(config.getDelaySeconds()))
                .block();
    }
}
