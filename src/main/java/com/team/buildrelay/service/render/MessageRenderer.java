package com.team.buildrelay.service.render;

import com.team.buildrelay.model.RenderedMessage;
import com.team.buildrelay.model.event.AnnotationStyle;
import com.team.buildrelay.model.event.BuildState;
import com.team.buildrelay.model.event.CiEvent;
import com.team.buildrelay.model.event.EventKind;
import com.team.buildrelay.util.TextTruncator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

import static java.util.Map.entry;

/**
 * Turns a Buildkite event into Zulip markdown plus a topic.
 *
 * Decides which events are worth posting at all: successful jobs and job
 * lifecycle noise (scheduled, started, ...) render to an empty message, which
 * callers treat as "filtered". Never throws; missing fields fall back to
 * placeholder text.
 */
@Component
@RequiredArgsConstructor
public class MessageRenderer {

    static final String FILTERED = "";
    static final String DEFAULT_TOPIC = "Build";
    static final String UNNAMED_JOB = "unnamed job";
    static final int MAX_JOB_NAME_LENGTH = 40;
    static final int SHORT_SHA_LENGTH = 7;

    record Status(String icon, String verb) {}

    private static final Map<EventKind, Status> LIFECYCLE = Map.ofEntries(
            entry(EventKind.BUILD_CREATED, new Status("🆕", "created")),
            entry(EventKind.BUILD_SCHEDULED, new Status("📅", "scheduled")),
            entry(EventKind.BUILD_STARTED, new Status("🔄", "started")),
            entry(EventKind.BUILD_RUNNING, new Status("🏃", "running")),
            entry(EventKind.BUILD_BLOCKED, new Status("🚫", "blocked")),
            entry(EventKind.BUILD_UNBLOCKED, new Status("🟢", "unblocked")),
            entry(EventKind.BUILD_CANCELED, new Status("⏹️", "canceled")),
            entry(EventKind.BUILD_REBUILT, new Status("🔁", "rebuilt")),
            entry(EventKind.AGENT_CONNECTED, new Status("🟢", "connected")),
            entry(EventKind.AGENT_DISCONNECTED, new Status("🔴", "disconnected")),
            entry(EventKind.PIPELINE_CREATED, new Status("🆕", "created")),
            entry(EventKind.PIPELINE_UPDATED, new Status("📝", "updated")),
            entry(EventKind.PIPELINE_DELETED, new Status("🗑️", "deleted"))
    );

    private static final Map<BuildState, Status> BUILD_RESULT = Map.of(
            BuildState.PASSED, new Status("✅", "passed"),
            BuildState.FAILED, new Status("❌", "failed"),
            BuildState.CANCELED, new Status("⏹️", "canceled")
    );
    private static final Status UNKNOWN_BUILD_RESULT = new Status("❓", "finished");

    private static final Map<AnnotationStyle, String> ANNOTATION_ICONS = Map.of(
            AnnotationStyle.SUCCESS, "✅",
            AnnotationStyle.WARNING, "⚠️",
            AnnotationStyle.ERROR, "❌",
            AnnotationStyle.INFO, "ℹ️"
    );
    private static final String DEFAULT_ANNOTATION_ICON = "📝";
    private static final String DELETED_ANNOTATION_ICON = "🗑️";

    private final RepositoryUrlResolver repositoryUrlResolver;
    private final TextTruncator textTruncator;

    public RenderedMessage render(CiEvent event) {
        String topic = formatTopic(event);
        String message = formatMessage(event);
        if (message.isEmpty()) {
            return RenderedMessage.filtered(topic);
        }
        return new RenderedMessage(message, topic);
    }

    /**
     * Render the chat message for an event.
     *
     * @return markdown text, or an empty string if the event should not be posted
     */
    public String formatMessage(CiEvent event) {
        EventKind kind = event.getKind() != null ? event.getKind() : EventKind.UNKNOWN;

        return switch (kind) {
            case BUILD_CREATED, BUILD_SCHEDULED, BUILD_STARTED -> formatBuildIntro(event, status(kind));
            case BUILD_RUNNING, BUILD_BLOCKED, BUILD_UNBLOCKED, BUILD_CANCELED, BUILD_REBUILT ->
                    formatBuildStatus(event.getBuildInfo(), status(kind));
            case BUILD_FINISHED, BUILD_PASSED, BUILD_FAILED -> formatBuildResult(event.getBuildInfo());
            case JOB_FINISHED -> formatJobFinished(event.getJob());
            // Only failed jobs are interesting; the rest of the job lifecycle is noise
            case JOB_SCHEDULED, JOB_ASSIGNED, JOB_STARTED, JOB_CANCELED, JOB_RETRIED, JOB_TIMED_OUT -> FILTERED;
            case AGENT_CONNECTED, AGENT_DISCONNECTED -> formatAgent(event.getAgent(), status(kind));
            case ANNOTATION_CREATED -> formatAnnotation(event.getAnnotation(), "created");
            case ANNOTATION_UPDATED -> formatAnnotation(event.getAnnotation(), "updated");
            case ANNOTATION_DELETED -> formatAnnotationDeleted(event.getAnnotation());
            case PIPELINE_CREATED, PIPELINE_UPDATED, PIPELINE_DELETED ->
                    formatPipeline(event.getPipeline(), status(kind));
            case UNKNOWN -> "📢 Buildkite event: " + (event.getRawKind() != null ? event.getRawKind() : "unknown");
        };
    }

    /**
     * Topic grouping all messages of one pipeline: "{pipeline name} - Build", or "Build"
     * when the event carries no pipeline name.
     */
    public String formatTopic(CiEvent event) {
        CiEvent.Pipeline pipeline = event.getPipeline();
        if (pipeline != null && pipeline.getName() != null && !pipeline.getName().isBlank()) {
            return pipeline.getName() + " - Build";
        }
        return DEFAULT_TOPIC;
    }

    /**
     * Name shown for a job: its label, else the first line of its command (capped at
     * 40 characters), else "unnamed job".
     */
    String jobDisplayName(CiEvent.Job job) {
        if (job.getName() != null && !job.getName().isBlank()) {
            return job.getName();
        }

        String firstLine = textTruncator.firstLine(job.getCommand());
        if (!firstLine.isEmpty()) {
            return textTruncator.truncate(firstLine, MAX_JOB_NAME_LENGTH);
        }

        return UNNAMED_JOB;
    }

    // build.created / build.scheduled / build.started quote the commit message
    private String formatBuildIntro(CiEvent event, Status status) {
        CiEvent.Build build = event.getBuildInfo();
        if (build == null) {
            return status.icon() + " Build " + status.verb();
        }

        String header = buildHeader(build, status);
        String commitMessage = build.getMessage();
        if (commitMessage == null || commitMessage.isBlank()) {
            return header;
        }

        return header + "\n> " + commitMessage + commitLink(build, event.getPipeline());
    }

    private String formatBuildStatus(CiEvent.Build build, Status status) {
        if (build == null) {
            return status.icon() + " Build " + status.verb();
        }
        return buildHeader(build, status);
    }

    private String formatBuildResult(CiEvent.Build build) {
        if (build == null) {
            return "✅ Build finished";
        }
        BuildState state = build.getState() != null ? build.getState() : BuildState.UNKNOWN;
        Status status = BUILD_RESULT.getOrDefault(state, UNKNOWN_BUILD_RESULT);
        return buildHeader(build, status);
    }

    private String formatJobFinished(CiEvent.Job job) {
        if (job == null) {
            return FILTERED;
        }

        Integer exitStatus = job.getExitStatus();
        if (exitStatus != null && exitStatus == 0) {
            return FILTERED;
        }

        // No exit status: the job reports finished without a result, surface it neutrally
        Status status = exitStatus != null ? new Status("❌", "failed") : new Status("❓", "finished");
        return String.format("%s Job ['%s'](%s) %s",
                status.icon(), jobDisplayName(job), linkOrPlaceholder(job.getWebUrl()), status.verb());
    }

    private String formatAgent(CiEvent.Agent agent, Status status) {
        if (agent == null) {
            return status.icon() + " Agent " + status.verb();
        }
        return String.format("%s Agent '%s' %s (%s)",
                status.icon(),
                agent.getName() != null ? agent.getName() : "unknown",
                status.verb(),
                agent.getHostname() != null ? agent.getHostname() : "unknown host");
    }

    private String formatAnnotation(CiEvent.Annotation annotation, String verb) {
        if (annotation == null) {
            return DEFAULT_ANNOTATION_ICON + " Annotation " + verb;
        }
        AnnotationStyle style = annotation.getStyle() != null ? annotation.getStyle() : AnnotationStyle.OTHER;
        String icon = ANNOTATION_ICONS.getOrDefault(style, DEFAULT_ANNOTATION_ICON);
        return icon + " Annotation " + verb + ": " + annotationContext(annotation);
    }

    private String formatAnnotationDeleted(CiEvent.Annotation annotation) {
        if (annotation == null) {
            return DELETED_ANNOTATION_ICON + " Annotation deleted";
        }
        return DELETED_ANNOTATION_ICON + " Annotation deleted: " + annotationContext(annotation);
    }

    private String formatPipeline(CiEvent.Pipeline pipeline, Status status) {
        if (pipeline == null) {
            return status.icon() + " Pipeline " + status.verb();
        }
        return String.format("%s Pipeline '%s' %s",
                status.icon(),
                pipeline.getName() != null ? pipeline.getName() : "unknown",
                status.verb());
    }

    private String buildHeader(CiEvent.Build build, Status status) {
        return String.format("%s Build [#%d](%s) %s",
                status.icon(),
                build.getNumber() != null ? build.getNumber() : 0,
                linkOrPlaceholder(build.getWebUrl()),
                status.verb());
    }

    /**
     * " ([abc1234](https://github.com/owner/repo/commit/abc1234...))", or empty when the
     * commit or the repository URL is unknown.
     */
    private String commitLink(CiEvent.Build build, CiEvent.Pipeline pipeline) {
        String commit = build.getCommit();
        if (commit == null || commit.isBlank()) {
            return "";
        }
        return repositoryUrlResolver.resolve(pipeline)
                .map(repoUrl -> String.format(" ([%s](%s/commit/%s))",
                        textTruncator.prefix(commit, SHORT_SHA_LENGTH), repoUrl, commit))
                .orElse("");
    }

    private String annotationContext(CiEvent.Annotation annotation) {
        return annotation.getContext() != null ? annotation.getContext() : "annotation";
    }

    private String linkOrPlaceholder(String url) {
        return url != null ? url : "#";
    }

    private Status status(EventKind kind) {
        return LIFECYCLE.getOrDefault(kind, new Status("📢", kind.getWireName()));
    }
}
