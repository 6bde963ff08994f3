package com.purchasingpower.appcommit.model.commit;

import lombok.Builder;

/**
 * Everything the pipeline needs to know about the commit to create.
 */
@Builder
public record CommitRequest(
        String commitMessage,
        boolean forcePush,
        String repoOwner,
        String repoName,
        String branchName,
        String headCommitId
) {
    public String repositoryNameWithOwner() {
        return repoOwner + "/" + repoName;
    }
}
