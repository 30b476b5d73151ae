package com.team.buildrelay.service.buildkite;

import com.team.buildrelay.model.dto.BuildkiteWebhookPayload;
import com.team.buildrelay.model.event.AnnotationStyle;
import com.team.buildrelay.model.event.BuildState;
import com.team.buildrelay.model.event.CiEvent;
import com.team.buildrelay.model.event.EventKind;
import org.springframework.stereotype.Component;

/**
 * Converts the raw Buildkite webhook payload into a {@link CiEvent}.
 * Event names, build states and annotation styles become enums; sections
 * missing from the payload stay null.
 */
@Component
public class WebhookEventMapper {

    public CiEvent toEvent(BuildkiteWebhookPayload payload) {
        return CiEvent.builder()
                .kind(EventKind.fromWireName(payload.getEvent()))
                .rawKind(payload.getEvent())
                .buildInfo(mapBuild(payload.getBuildInfo()))
                .job(mapJob(payload.getJob()))
                .pipeline(mapPipeline(payload.getPipeline()))
                .agent(mapAgent(payload.getAgent()))
                .annotation(mapAnnotation(payload.getAnnotation()))
                .build();
    }

    private CiEvent.Build mapBuild(BuildkiteWebhookPayload.Build build) {
        if (build == null) return null;
        return CiEvent.Build.builder()
                .number(build.getNumber())
                .state(BuildState.fromWireName(build.getState()))
                .message(build.getMessage())
                .commit(build.getCommit())
                .webUrl(build.getWebUrl())
                .build();
    }

    private CiEvent.Job mapJob(BuildkiteWebhookPayload.Job job) {
        if (job == null) return null;
        return CiEvent.Job.builder()
                .name(job.getName())
                .command(job.getCommand())
                .exitStatus(job.getExitStatus())
                .webUrl(job.getWebUrl())
                .build();
    }

    private CiEvent.Pipeline mapPipeline(BuildkiteWebhookPayload.Pipeline pipeline) {
        if (pipeline == null) return null;
        return CiEvent.Pipeline.builder()
                .name(pipeline.getName())
                .repository(pipeline.getRepository())
                .provider(mapProvider(pipeline.getProvider()))
                .build();
    }

    private CiEvent.Provider mapProvider(BuildkiteWebhookPayload.Provider provider) {
        if (provider == null) return null;
        return CiEvent.Provider.builder()
                .repositoryUrl(provider.getRepositoryUrl())
                .settingsRepository(provider.getSettings() != null
                        ? provider.getSettings().getRepository() : null)
                .build();
    }

    private CiEvent.Agent mapAgent(BuildkiteWebhookPayload.Agent agent) {
        if (agent == null) return null;
        return CiEvent.Agent.builder()
                .name(agent.getName())
                .hostname(agent.getHostname())
                .build();
    }

    private CiEvent.Annotation mapAnnotation(BuildkiteWebhookPayload.Annotation annotation) {
        if (annotation == null) return null;
        return CiEvent.Annotation.builder()
                .style(AnnotationStyle.fromWireName(annotation.getStyle()))
                .context(annotation.getContext())
                .build();
    }
}
