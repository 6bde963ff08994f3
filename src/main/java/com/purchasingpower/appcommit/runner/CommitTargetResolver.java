package com.purchasingpower.appcommit.runner;

import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.configuration.GitHubProperties;
import com.purchasingpower.appcommit.exception.PreconditionException;
import com.purchasingpower.appcommit.model.commit.CommitRequest;
import com.purchasingpower.appcommit.repository.LocalGitRepository;
import com.purchasingpower.appcommit.util.GitHubRemoteUrlParser;
import com.purchasingpower.appcommit.util.GitHubRemoteUrlParser.OwnerAndRepo;
import com.purchasingpower.appcommit.util.GitInputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Works out where the commit goes: branch and parent from HEAD, repository from configuration or the remote.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CommitTargetResolver {

    private final LocalGitRepository localGitRepository;
    private final AppProperties appProperties;

    /**
     * @param ownerOverride takes precedence over configuration and the remote when not blank
     * @param repoOverride  takes precedence over configuration and the remote when not blank
     */
    public CommitRequest resolve(String message, boolean force, String ownerOverride, String repoOverride) {
        String branch = localGitRepository.currentBranchName()
                .orElseThrow(() -> new PreconditionException("HEAD is detached; check out a branch to commit to"));
        String headCommit = localGitRepository.headCommitId()
                .orElseThrow(() -> new PreconditionException("HEAD does not point at a commit"));

        GitHubProperties github = appProperties.getGithub();
        String owner = firstNonBlank(ownerOverride, github.getRepoOwner());
        String repo = firstNonBlank(repoOverride, github.getRepoName());
        if (owner == null || repo == null) {
            String remoteName = appProperties.getGit().getRemoteName();
            String url = localGitRepository.remoteUrl(remoteName)
                    .orElseThrow(() -> new PreconditionException(
                            "Remote '" + remoteName + "' has no URL; configure app.github.repo-owner/repo-name"));
            OwnerAndRepo parsed = GitHubRemoteUrlParser.parse(url);
            owner = owner != null ? owner : parsed.owner();
            repo = repo != null ? repo : parsed.repo();
        }

        try {
            GitInputValidator.validateBranchName(branch);
            GitInputValidator.validateRepoSegment("owner", owner);
            GitInputValidator.validateRepoSegment("name", repo);
        } catch (IllegalArgumentException e) {
            throw new PreconditionException(e.getMessage(), e);
        }

        log.info("Commit target: {}/{} branch {} on top of {}", owner, repo, branch, headCommit);
        return CommitRequest.builder()
                .commitMessage(message)
                .forcePush(force)
                .repoOwner(owner)
                .repoName(repo)
                .branchName(branch)
                .headCommitId(headCommit)
                .build();
    }

    private static String firstNonBlank(String first, String second) {
        if (StringUtils.hasText(first)) {
            return first;
        }
        return StringUtils.hasText(second) ? second : null;
    }
}
