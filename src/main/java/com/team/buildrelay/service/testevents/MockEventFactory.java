package com.team.buildrelay.service.testevents;

import com.team.buildrelay.model.dto.BuildkiteWebhookPayload;
import com.team.buildrelay.model.dto.BuildkiteWebhookPayload.Author;
import com.team.buildrelay.model.dto.BuildkiteWebhookPayload.Build;
import com.team.buildrelay.model.dto.BuildkiteWebhookPayload.Job;
import com.team.buildrelay.model.dto.BuildkiteWebhookPayload.Pipeline;
import com.team.buildrelay.model.dto.BuildkiteWebhookPayload.Provider;
import com.team.buildrelay.model.dto.BuildkiteWebhookPayload.ProviderSettings;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Builds realistic Buildkite payloads for exercising a running relay end to end.
 */
@Component
public class MockEventFactory {

    public static final List<String> EVENT_TYPES = List.of(
            "build-started", "build-passed", "build-failed", "build-canceled",
            "job-passed", "job-failed", "all", "scenario", "lang-routing", "keyboard-routing");

    private static final String ORG_URL = "https://buildkite.com/my-org";
    private static final String API_URL = "https://api.buildkite.com/v2/organizations/my-org/pipelines";

    /**
     * Payloads for a named event set, in the order they should be sent.
     *
     * @throws IllegalArgumentException for an unknown event type
     */
    public List<BuildkiteWebhookPayload> create(String eventType, int buildNumber) {
        return switch (eventType) {
            case "build-started" -> List.of(buildStarted(buildNumber));
            case "build-passed" -> List.of(buildFinished("passed", buildNumber));
            case "build-failed" -> List.of(buildFinished("failed", buildNumber));
            case "build-canceled" -> List.of(buildFinished("canceled", buildNumber));
            case "job-passed" -> List.of(jobFinished(0, buildNumber));
            case "job-failed" -> List.of(jobFinished(1, buildNumber));
            case "all" -> List.of(
                    buildStarted(buildNumber),
                    jobFinished(0, buildNumber),
                    jobFinished(1, buildNumber),
                    buildFinished("passed", buildNumber));
            case "scenario" -> List.of(
                    buildStarted(buildNumber),
                    jobFinished(0, buildNumber),
                    jobFinished(1, buildNumber),
                    buildFinished("failed", buildNumber));
            case "lang-routing" -> List.of(projectBuildStarted("lang-sami-x-private",
                    "Update language pack translations", "lang123456789012345678901234567890abcd",
                    "Language Team", "lang@example.com", buildNumber));
            case "keyboard-routing" -> List.of(projectBuildStarted("keyboard-finnish-public",
                    "Update keyboard layout definitions", "kbd123456789012345678901234567890abcd",
                    "Keyboard Team", "keyboard@example.com", buildNumber));
            default -> throw new IllegalArgumentException(String.format(
                    "Unknown event type: %s. Valid types: %s", eventType, String.join(", ", EVENT_TYPES)));
        };
    }

    BuildkiteWebhookPayload buildStarted(int buildNumber) {
        return BuildkiteWebhookPayload.builder()
                .event("build.started")
                .buildInfo(Build.builder()
                        .id("build-started-" + buildNumber)
                        .number(buildNumber)
                        .state("running")
                        .message("Add new feature for user authentication")
                        .commit("a1b2c3d4e5f6789012345678901234567890abcd")
                        .branch("feature/auth-improvements")
                        .url(API_URL + "/my-pipeline/builds/" + buildNumber)
                        .webUrl(ORG_URL + "/my-pipeline/builds/" + buildNumber)
                        .author(Author.builder().name("Alice Developer").email("alice@example.com").build())
                        .build())
                .pipeline(awesomePipeline())
                .build();
    }

    BuildkiteWebhookPayload buildFinished(String state, int buildNumber) {
        String commit;
        String message;
        String author;
        switch (state) {
            case "passed" -> {
                commit = "b2c3d4e5f6789012345678901234567890abcdef";
                message = "Fix critical security vulnerability";
                author = "Bob Tester";
            }
            case "failed" -> {
                commit = "c3d4e5f6789012345678901234567890abcdef12";
                message = "Update dependencies to latest versions";
                author = "Charlie Developer";
            }
            case "canceled" -> {
                commit = "d4e5f6789012345678901234567890abcdef1234";
                message = "Refactor database connection handling";
                author = "Dana Engineer";
            }
            default -> {
                commit = "unknown1234567890abcdef1234567890abcdef12";
                message = "Unknown build message";
                author = "Unknown Author";
            }
        }

        return BuildkiteWebhookPayload.builder()
                .event("build.finished")
                .buildInfo(Build.builder()
                        .id("build-" + state + "-" + buildNumber)
                        .number(buildNumber)
                        .state(state)
                        .message(message)
                        .commit(commit)
                        .branch("main")
                        .url(API_URL + "/my-pipeline/builds/" + buildNumber)
                        .webUrl(ORG_URL + "/my-pipeline/builds/" + buildNumber)
                        .author(Author.builder()
                                .name(author)
                                .email(author.toLowerCase(Locale.ROOT).replace(" ", ".") + "@example.com")
                                .build())
                        .build())
                .pipeline(awesomePipeline())
                .build();
    }

    BuildkiteWebhookPayload jobFinished(int exitStatus, int buildNumber) {
        boolean passed = exitStatus == 0;
        String jobId = passed ? "job-tests-123" : "job-lint-456";

        return BuildkiteWebhookPayload.builder()
                .event("job.finished")
                .job(Job.builder()
                        .id(jobId)
                        .name(passed ? "Unit Tests" : "Linting")
                        .command("npm test")
                        .state(passed ? "passed" : "failed")
                        .exitStatus(exitStatus)
                        .webUrl(ORG_URL + "/my-pipeline/builds/" + buildNumber + "#" + jobId)
                        .build())
                .pipeline(awesomePipeline())
                .build();
    }

    private BuildkiteWebhookPayload projectBuildStarted(String pipelineName, String message, String commit,
                                                        String author, String email, int buildNumber) {
        String prefix = pipelineName.substring(0, pipelineName.indexOf('-'));

        return BuildkiteWebhookPayload.builder()
                .event("build.started")
                .buildInfo(Build.builder()
                        .id(prefix + "-build-" + buildNumber)
                        .number(buildNumber)
                        .state("running")
                        .message(message)
                        .commit(commit)
                        .branch("main")
                        .url(API_URL + "/" + pipelineName + "/builds/" + buildNumber)
                        .webUrl(ORG_URL + "/" + pipelineName + "/builds/" + buildNumber)
                        .author(Author.builder().name(author).email(email).build())
                        .build())
                .pipeline(pipeline(prefix + "-pipeline-123", pipelineName))
                .build();
    }

    private Pipeline awesomePipeline() {
        return pipeline("pipeline-123", "My Awesome Pipeline");
    }

    private Pipeline pipeline(String id, String name) {
        String slug = name.toLowerCase(Locale.ROOT).replace(' ', '-');
        return Pipeline.builder()
                .id(id)
                .name(name)
                .slug(slug)
                .url(API_URL + "/" + slug)
                .webUrl(ORG_URL + "/" + slug)
                .repository("git@github.com:my-org/my-repo.git")
                .provider(Provider.builder()
                        .id("github")
                        .settings(ProviderSettings.builder().repository("my-org/my-repo").build())
                        .repositoryUrl("https://github.com/my-org/my-repo")
                        .build())
                .build();
    }
}
