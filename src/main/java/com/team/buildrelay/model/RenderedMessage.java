package com.team.buildrelay.model;

import lombok.Value;

/**
 * Chat text and Zulip topic produced for one event. An empty message means the
 * event was filtered out and nothing should be posted.
 */
@Value
public class RenderedMessage {

    String message;
    String topic;

    public static RenderedMessage filtered(String topic) {
        return new RenderedMessage("", topic);
    }

    public boolean isFiltered() {
        return message == null || message.isBlank();
    }
}
