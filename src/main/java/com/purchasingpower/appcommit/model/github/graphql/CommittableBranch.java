package com.purchasingpower.appcommit.model.github.graphql;

public record CommittableBranch(String repositoryNameWithOwner, String branchName) {
}
