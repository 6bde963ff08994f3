package com.purchasingpower.appcommit.model.github;

import java.util.List;

/**
 * https://docs.github.com/en/rest/git/commits#create-a-commit
 */
public record CreateCommitRequest(String message, List<String> parents, String tree) {
}
