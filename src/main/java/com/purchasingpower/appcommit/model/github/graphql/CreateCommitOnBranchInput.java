package com.purchasingpower.appcommit.model.github.graphql;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Input of the {@code createCommitOnBranch} mutation.
 * https://docs.github.com/en/graphql/reference/input-objects#createcommitonbranchinput
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateCommitOnBranchInput(
        CommittableBranch branch,
        String expectedHeadOid,
        FileChanges fileChanges,
        CommitMessage message
) {
}
