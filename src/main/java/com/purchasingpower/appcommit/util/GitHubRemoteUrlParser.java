package com.purchasingpower.appcommit.util;

import com.purchasingpower.appcommit.exception.PreconditionException;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts owner and repository name from a GitHub remote URL.
 *
 * Handles:
 * - git@github.com:owner/repo.git
 * - ssh://git@github.com/owner/repo.git
 * - https://github.com/owner/repo(.git)
 */
public final class GitHubRemoteUrlParser {

    private static final Pattern SCP_STYLE = Pattern.compile("^git@github\\.com:(.+)/(.+)$");
    private static final Pattern URL_STYLE =
            Pattern.compile("^(?:https://(?:[^@/]+@)?|ssh://git@)github\\.com(?::\\d+)?/(.+)/(.+)$");

    private GitHubRemoteUrlParser() {
    }

    public record OwnerAndRepo(String owner, String repo) {
    }

    /**
     * @throws PreconditionException if the URL does not point at github.com
     */
    public static OwnerAndRepo parse(String remoteUrl) {
        if (remoteUrl == null || remoteUrl.isBlank()) {
            throw new PreconditionException("Remote URL is empty");
        }
        String url = trimTrailing(remoteUrl.trim());

        Matcher matcher = SCP_STYLE.matcher(url);
        if (!matcher.matches()) {
            matcher = URL_STYLE.matcher(url);
        }
        if (!matcher.matches()) {
            throw new PreconditionException("Remote URL is not a GitHub repository: " + remoteUrl);
        }

        String owner = matcher.group(1);
        String repo = matcher.group(2);
        if (owner.isEmpty() || repo.isEmpty() || owner.contains("/") || repo.contains("/")) {
            throw new PreconditionException("Unable to extract owner and repository from remote URL: " + remoteUrl);
        }
        return new OwnerAndRepo(owner, repo);
    }

    private static String trimTrailing(String url) {
        String name = url;
        while (name.endsWith("/")) {
            name = name.substring(0, name.length() - 1);
        }
        if (name.endsWith(".git")) {
            name = name.substring(0, name.length() - 4);
        }
        return name;
    }
}
