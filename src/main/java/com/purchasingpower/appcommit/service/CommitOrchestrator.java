package com.purchasingpower.appcommit.service;

import com.google.common.base.Preconditions;
import com.purchasingpower.appcommit.client.GitHubApiClient;
import com.purchasingpower.appcommit.configuration.AppProperties;
import com.purchasingpower.appcommit.configuration.GitHubProperties.CommitStrategy;
import com.purchasingpower.appcommit.exception.PreconditionException;
import com.purchasingpower.appcommit.model.commit.CommitAction;
import com.purchasingpower.appcommit.model.commit.CommitRequest;
import com.purchasingpower.appcommit.model.commit.PlannedAction;
import com.purchasingpower.appcommit.model.git.PathChange;
import com.purchasingpower.appcommit.model.github.CommitResponse;
import com.purchasingpower.appcommit.model.github.CreateCommitRequest;
import com.purchasingpower.appcommit.model.github.CreateReferenceRequest;
import com.purchasingpower.appcommit.model.github.CreateTreeRequest;
import com.purchasingpower.appcommit.model.github.ReferenceResponse;
import com.purchasingpower.appcommit.model.github.TreeResponse;
import com.purchasingpower.appcommit.model.github.UpdateReferenceRequest;
import com.purchasingpower.appcommit.model.github.graphql.CreateCommitOnBranchInput;
import com.purchasingpower.appcommit.service.impl.FileChangesPayloadAssembler;
import com.purchasingpower.appcommit.service.impl.TreePayloadAssembler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Drives one run: staged changes → actions → payload → GitHub, then moves the branch.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommitOrchestrator {

    private final ChangeSetReader changeSetReader;
    private final TreePayloadAssembler treePayloadAssembler;
    private final FileChangesPayloadAssembler fileChangesPayloadAssembler;
    private final GitHubApiClient gitHubApiClient;
    private final AppProperties appProperties;

    /**
     * @return URL of the created commit
     */
    public String commit(CommitRequest request) {
        Preconditions.checkNotNull(request, "request");
        Preconditions.checkArgument(request.commitMessage() != null, "commit message is required");

        List<PathChange> changes = changeSetReader.readChanges();
        if (changes.isEmpty()) {
            throw new PreconditionException("No changes to commit");
        }

        List<PlannedAction> actions = ActionResolver.plan(changes);
        boolean anythingToCommit = actions.stream()
                .anyMatch(a -> a.action() == CommitAction.ADD_PATH || a.action().isDeletion());
        if (!anythingToCommit) {
            throw new PreconditionException("No changes to commit");
        }

        CommitStrategy strategy = appProperties.getGithub().getCommitStrategy();
        log.info("Committing {} action(s) to {}:{} using {} strategy",
                actions.size(), request.repositoryNameWithOwner(), request.branchName(), strategy);

        String url = switch (strategy) {
            case TREE -> commitWithTree(request, actions);
            case FILE_CHANGES -> commitWithFileChanges(request, actions);
        };
        log.info("✅ Commit created: {}", url);
        return url;
    }

    private String commitWithTree(CommitRequest request, List<PlannedAction> actions) {
        String owner = request.repoOwner();
        String repo = request.repoName();

        CreateTreeRequest treeRequest = treePayloadAssembler.assemble(request, actions);
        TreeResponse tree = gitHubApiClient.createTree(owner, repo, treeRequest);
        CommitResponse commit = gitHubApiClient.createCommit(owner, repo,
                new CreateCommitRequest(request.commitMessage(), List.of(request.headCommitId()), tree.sha()));

        String branch = request.branchName();
        Optional<ReferenceResponse> existing = gitHubApiClient.getReference(owner, repo, branch);
        if (existing.isPresent()) {
            log.info("Updating heads/{} to {} (force={})", branch, commit.sha(), request.forcePush());
            gitHubApiClient.updateReference(owner, repo, branch,
                    new UpdateReferenceRequest(commit.sha(), request.forcePush()));
        } else {
            log.info("Creating refs/heads/{} at {}", branch, commit.sha());
            gitHubApiClient.createReference(owner, repo,
                    new CreateReferenceRequest("refs/heads/" + branch, commit.sha()));
        }
        return commit.htmlUrl();
    }

    private String commitWithFileChanges(CommitRequest request, List<PlannedAction> actions) {
        CreateCommitOnBranchInput input = fileChangesPayloadAssembler.assemble(request, actions);
        return gitHubApiClient.createCommitOnBranch(input);
    }
}
