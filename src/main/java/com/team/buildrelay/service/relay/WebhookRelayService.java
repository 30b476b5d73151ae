package com.team.buildrelay.service.relay;

import com.team.buildrelay.config.ZulipConfig;
import com.team.buildrelay.model.RelayOutcome;
import com.team.buildrelay.model.RenderedMessage;
import com.team.buildrelay.model.dto.BuildkiteWebhookPayload;
import com.team.buildrelay.model.event.CiEvent;
import com.team.buildrelay.service.buildkite.WebhookEventMapper;
import com.team.buildrelay.service.notification.ZulipNotificationService;
import com.team.buildrelay.service.render.MessageRenderer;
import com.team.buildrelay.service.routing.ChannelRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Relays one Buildkite webhook delivery to Zulip.
 *
 * Flow:
 * 1. Map the payload to a {@link CiEvent}
 * 2. Render message and topic; stop here if the event is filtered
 * 3. Pick the destination stream
 * 4. Post to Zulip
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookRelayService {

    private final WebhookEventMapper eventMapper;
    private final MessageRenderer messageRenderer;
    private final ChannelRouter channelRouter;
    private final ZulipNotificationService zulipNotificationService;
    private final ZulipConfig zulipConfig;

    /**
     * @return {@code FILTERED} without contacting Zulip, {@code DELIVERED} once Zulip
     *         accepted the message, or an error if delivery failed
     */
    public Mono<RelayOutcome> relay(BuildkiteWebhookPayload payload) {
        CiEvent event = eventMapper.toEvent(payload);
        RenderedMessage rendered = messageRenderer.render(event);

        if (rendered.isFiltered()) {
            log.info("Skipping filtered event: {}", payload.getEvent());
            return Mono.just(RelayOutcome.filtered(rendered.getTopic()));
        }

        String channel = channelRouter.route(event, zulipConfig.getStream());

        return zulipNotificationService.sendStreamMessage(channel, rendered.getTopic(), rendered.getMessage())
                .thenReturn(RelayOutcome.delivered(channel, rendered.getTopic()))
                .doOnSuccess(outcome -> log.info("Sent {} to Zulip stream '{}', topic '{}'",
                        payload.getEvent(), channel, rendered.getTopic()))
                .doOnError(e -> log.debug("Failed to relay {} to Zulip stream '{}': {}",
                        payload.getEvent(), channel, e.getMessage()));
    }
}
