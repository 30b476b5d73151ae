package com.team.buildrelay.service.testevents;

import com.team.buildrelay.model.dto.BuildkiteWebhookPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MockEventFactoryTest {

    private final MockEventFactory factory = new MockEventFactory();

    @ParameterizedTest
    @ValueSource(strings = {"build-started", "build-passed", "build-failed", "build-canceled",
            "job-passed", "job-failed", "lang-routing", "keyboard-routing"})
    void shouldCreateSingleEventTypes(String eventType) {
        assertThat(factory.create(eventType, 123)).hasSize(1);
    }

    @Test
    void shouldCreateAllInLifecycleOrder() {
        List<BuildkiteWebhookPayload> events = factory.create("all", 123);

        assertThat(events).extracting(BuildkiteWebhookPayload::getEvent)
                .containsExactly("build.started", "job.finished", "job.finished", "build.finished");
        assertThat(events.get(1).getJob().getExitStatus()).isZero();
        assertThat(events.get(2).getJob().getExitStatus()).isEqualTo(1);
        assertThat(events.get(3).getBuildInfo().getState()).isEqualTo("passed");
    }

    @Test
    void shouldEndScenarioWithFailedBuild() {
        List<BuildkiteWebhookPayload> events = factory.create("scenario", 123);

        assertThat(events).hasSize(4);
        assertThat(events.get(3).getBuildInfo().getState()).isEqualTo("failed");
        assertThat(events.get(3).getBuildInfo().getAuthor().getEmail()).isEqualTo("charlie.developer@example.com");
    }

    @Test
    void shouldUseBuildNumberInUrls() {
        BuildkiteWebhookPayload event = factory.create("build-started", 777).get(0);

        assertThat(event.getBuildInfo().getNumber()).isEqualTo(777);
        assertThat(event.getBuildInfo().getWebUrl()).endsWith("/my-pipeline/builds/777");
        assertThat(event.getPipeline().getProvider().getRepositoryUrl()).isEqualTo("https://github.com/my-org/my-repo");
    }

    @Test
    void shouldNameRoutingPipelinesByProject() {
        assertThat(factory.create("lang-routing", 1).get(0).getPipeline().getName())
                .isEqualTo("lang-sami-x-private");
        assertThat(factory.create("keyboard-routing", 1).get(0).getPipeline().getName())
                .isEqualTo("keyboard-finnish-public");
    }

    @Test
    void shouldRejectUnknownEventType() {
        assertThatThrownBy(() -> factory.create("build-exploded", 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown event type: build-exploded")
                .hasMessageContaining("scenario");
    }
}
