package com.team.buildrelay.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Settings for the synthetic test-event sender (profile {@code send-test-events}).
 */
@Configuration
@ConfigurationProperties(prefix = "relay.test-events")
@Getter
@Setter
public class TestEventConfig {

    private String serverUrl = "http://localhost:3000";
    private String eventType = "all";
    private int delaySeconds = 2;
    private int buildNumber = 123;
}
