package com.team.buildrelay.service.routing;

import com.team.buildrelay.model.event.CiEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Picks the Zulip stream for an event.
 *
 * Per-project pipelines follow the naming convention {@code lang-<project>-...}
 * or {@code keyboard-<project>-...} and are posted to the {@code <project>} stream,
 * so new pipelines fan out without extra configuration. Everything else goes to
 * the configured default stream.
 */
@Component
@Slf4j
public class ChannelRouter {

    private static final List<String> PROJECT_PREFIXES = List.of("lang-", "keyboard-");

    public String route(CiEvent event, String defaultChannel) {
        if (event == null || event.getPipeline() == null || event.getPipeline().getName() == null) {
            return defaultChannel;
        }

        String name = event.getPipeline().getName().toLowerCase(Locale.ROOT);
        if (PROJECT_PREFIXES.stream().noneMatch(name::startsWith)) {
            return defaultChannel;
        }

        // lang-foo-x-private → [lang, foo, x, private]
        String[] parts = name.split("-", -1);
        if (parts.length < 2 || parts[1].isEmpty()) {
            log.debug("Pipeline '{}' has a project prefix but no project segment", name);
            return defaultChannel;
        }
        return parts[1];
    }
}
