package com.team.buildrelay.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of relaying one webhook delivery.
 */
@Value
@Builder
public class RelayOutcome {

    Status status;
    String channel;     // null when filtered
    String topic;

    public enum Status {
        DELIVERED, FILTERED
    }

    public static RelayOutcome filtered(String topic) {
        return RelayOutcome.builder().status(Status.FILTERED).topic(topic).build();
    }

    public static RelayOutcome delivered(String channel, String topic) {
        return RelayOutcome.builder().status(Status.DELIVERED).channel(channel).topic(topic).build();
    }
}
