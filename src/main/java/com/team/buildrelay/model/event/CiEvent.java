package com.team.buildrelay.model.event;

import lombok.Builder;
import lombok.Value;

/**
 * Normalized, immutable view of one Buildkite webhook delivery.
 *
 * Only {@code kind} is guaranteed. Which section is populated depends on the event
 * family, but nothing enforces it, so consumers must treat every section and field
 * as optional.
 */
@Value
@Builder
public class CiEvent {

    EventKind kind;
    String rawKind;     // event name exactly as received, used for unknown kinds

    Build buildInfo;
    Job job;
    Pipeline pipeline;
    Agent agent;
    Annotation annotation;

    @Value
    @Builder
    public static class Build {
        Integer number;
        @Builder.Default
        BuildState state = BuildState.UNKNOWN;
        String message;
        String commit;
        String webUrl;
    }

    @Value
    @Builder
    public static class Job {
        String name;
        String command;
        Integer exitStatus;
        String webUrl;
    }

    @Value
    @Builder
    public static class Pipeline {
        String name;
        String repository;
        Provider provider;
    }

    @Value
    @Builder
    public static class Provider {
        String repositoryUrl;
        String settingsRepository;  // owner/repo slug from provider.settings.repository
    }

    @Value
    @Builder
    public static class Agent {
        String name;
        String hostname;
    }

    @Value
    @Builder
    public static class Annotation {
        @Builder.Default
        AnnotationStyle style = AnnotationStyle.OTHER;
        String context;
    }
}
