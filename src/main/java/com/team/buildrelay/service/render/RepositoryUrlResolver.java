package com.team.buildrelay.service.render;

import com.team.buildrelay.model.event.CiEvent;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Derives the GitHub web URL of a pipeline's repository, used to link commits.
 *
 * Resolution order, first match wins:
 * 1. provider.repository_url, verbatim
 * 2. provider.settings.repository ("owner/repo") → https://github.com/owner/repo
 * 3. pipeline.repository in git@github.com:owner/repo.git or https://github.com/owner/repo.git form
 *
 * Any other repository syntax resolves to empty.
 */
@Component
public class RepositoryUrlResolver {

    static final String GITHUB_WEB = "https://github.com/";
    private static final String GITHUB_SSH_PREFIX = "git@github.com:";
    private static final String GIT_SUFFIX = ".git";

    public Optional<String> resolve(CiEvent.Pipeline pipeline) {
        if (pipeline == null) return Optional.empty();

        CiEvent.Provider provider = pipeline.getProvider();
        if (provider != null) {
            if (provider.getRepositoryUrl() != null) {
                return Optional.of(provider.getRepositoryUrl());
            }
            if (provider.getSettingsRepository() != null) {
                return Optional.of(GITHUB_WEB + provider.getSettingsRepository());
            }
        }

        String repository = pipeline.getRepository();
        if (repository == null) return Optional.empty();

        // git@github.com:owner/repo.git → https://github.com/owner/repo
        if (repository.startsWith(GITHUB_SSH_PREFIX)) {
            String slug = stripGitSuffix(repository.substring(GITHUB_SSH_PREFIX.length()));
            return Optional.of(GITHUB_WEB + slug);
        }
        if (repository.startsWith(GITHUB_WEB)) {
            return Optional.of(stripGitSuffix(repository));
        }

        return Optional.empty();
    }

    private String stripGitSuffix(String value) {
        return value.endsWith(GIT_SUFFIX)
                ? value.substring(0, value.length() - GIT_SUFFIX.length())
                : value;
    }
}
