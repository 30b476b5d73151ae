package com.team.buildrelay.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Zulip bot credentials and the stream used when no pipeline-specific
 * stream applies. Values normally come from the ZULIP_* environment variables.
 */
@Configuration
@ConfigurationProperties(prefix = "zulip")
@Getter
@Setter
public class ZulipConfig {

    private String botEmail;
    private String botApiKey;
    private String serverUrl;
    private String stream;
    private int timeoutSeconds = 30;

    @Bean(name = "zulipWebClient")
    public WebClient zulipWebClient() {
        String credentials = nullToEmpty(botEmail) + ":" + nullToEmpty(botApiKey);
        String encoded = Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));

        return WebClient.builder()
                .baseUrl(getApiBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Basic " + encoded)
                .build();
    }

    /**
     * Returns the base URL for Zulip REST calls.
     * Format: {serverUrl}/api/v1
     */
    public String getApiBaseUrl() {
        String base = nullToEmpty(serverUrl);
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base + "/api/v1";
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
