package com.team.buildrelay.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for the Buildkite webhook payload.
 * Buildkite posts this JSON for every subscribed build, job, agent,
 * annotation and pipeline event. Every section except {@code event} is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BuildkiteWebhookPayload {

    private String event;

    @JsonProperty("build")
    private Build buildInfo;

    private Job job;
    private Pipeline pipeline;
    private Agent agent;
    private Annotation annotation;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Build {
        private String id;
        private Integer number;
        private String state;
        private String message;     // commit message that triggered the build
        private String commit;
        private String branch;
        private String url;

        @JsonProperty("web_url")
        private String webUrl;

        private Author author;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Author {
        private String name;
        private String email;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Job {
        private String id;
        private String name;
        private String command;
        private String state;

        @JsonProperty("exit_status")
        private Integer exitStatus;  // null while the job is still running

        @JsonProperty("web_url")
        private String webUrl;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Pipeline {
        private String id;
        private String name;
        private String slug;
        private String url;

        @JsonProperty("web_url")
        private String webUrl;

        private String repository;  // git@github.com:owner/repo.git or https://github.com/owner/repo.git
        private Provider provider;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Provider {
        private String id;
        private ProviderSettings settings;

        @JsonProperty("repository_url")
        private String repositoryUrl;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ProviderSettings {
        private String repository;  // owner/repo
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Agent {
        private String id;
        private String name;
        private String hostname;
        private String version;

        @JsonProperty("connection_state")
        private String connectionState;

        @JsonProperty("ip_address")
        private String ipAddress;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Annotation {
        private String id;
        private String body;
        private String style;
        private String context;

        @JsonProperty("created_at")
        private String createdAt;

        @JsonProperty("updated_at")
        private String updatedAt;
    }
}
