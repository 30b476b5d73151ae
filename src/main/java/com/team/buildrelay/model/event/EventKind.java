package com.team.buildrelay.model.event;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Every Buildkite webhook event name the relay knows how to handle.
 * Names Buildkite may add later map to {@link #UNKNOWN}.
 */
public enum EventKind {

    BUILD_CREATED("build.created"),
    BUILD_SCHEDULED("build.scheduled"),
    BUILD_STARTED("build.started"),
    BUILD_RUNNING("build.running"),
    BUILD_BLOCKED("build.blocked"),
    BUILD_UNBLOCKED("build.unblocked"),
    BUILD_CANCELED("build.canceled"),
    BUILD_REBUILT("build.rebuilt"),
    BUILD_FINISHED("build.finished"),
    BUILD_PASSED("build.passed"),
    BUILD_FAILED("build.failed"),

    JOB_SCHEDULED("job.scheduled"),
    JOB_ASSIGNED("job.assigned"),
    JOB_STARTED("job.started"),
    JOB_FINISHED("job.finished"),
    JOB_CANCELED("job.canceled"),
    JOB_RETRIED("job.retried"),
    JOB_TIMED_OUT("job.timed_out"),

    AGENT_CONNECTED("agent.connected"),
    AGENT_DISCONNECTED("agent.disconnected"),

    ANNOTATION_CREATED("annotation.created"),
    ANNOTATION_UPDATED("annotation.updated"),
    ANNOTATION_DELETED("annotation.deleted"),

    PIPELINE_CREATED("pipeline.created"),
    PIPELINE_UPDATED("pipeline.updated"),
    PIPELINE_DELETED("pipeline.deleted"),

    UNKNOWN("");

    private static final Map<String, EventKind> BY_WIRE_NAME = Arrays.stream(values())
            .filter(kind -> kind != UNKNOWN)
            .collect(Collectors.toUnmodifiableMap(EventKind::getWireName, Function.identity()));

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Look up the kind for a Buildkite event name. Matching is exact, as Buildkite sends
     * lower-case dotted names.
     */
    public static EventKind fromWireName(String name) {
        if (name == null) return UNKNOWN;
        return BY_WIRE_NAME.getOrDefault(name, UNKNOWN);
    }
}
