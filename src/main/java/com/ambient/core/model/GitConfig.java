package com.ambient.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitConfig(
    GitUser user,
    GitAuthentication authentication,
    List<GitRepository> repositories
) {

    /**
     * Merges tenant defaults under this (caller supplied) configuration.
     * Caller values win for user and authentication; repositories are the caller's
     * entries first, followed by default entries whose URL is not already present.
     */
    public GitConfig mergedOver(GitConfig defaults) {
        if (defaults == null) {
            return this;
        }
        GitUser mergedUser = user != null ? user : defaults.user();
        GitAuthentication mergedAuth = authentication != null ? authentication : defaults.authentication();

        List<GitRepository> merged = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        if (repositories != null) {
            for (GitRepository repo : repositories) {
                merged.add(repo);
                seen.add(repo.url());
            }
        }
        if (defaults.repositories() != null) {
            for (GitRepository repo : defaults.repositories()) {
                if (seen.add(repo.url())) {
                    merged.add(repo);
                }
            }
        }
        return new GitConfig(mergedUser, mergedAuth, merged.isEmpty() ? null : merged);
    }

    public boolean isEmpty() {
        return user == null && authentication == null && (repositories == null || repositories.isEmpty());
    }
}
