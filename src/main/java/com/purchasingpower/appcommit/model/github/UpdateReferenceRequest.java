package com.purchasingpower.appcommit.model.github;

/**
 * https://docs.github.com/en/rest/git/refs#update-a-reference
 */
public record UpdateReferenceRequest(String sha, boolean force) {
}
