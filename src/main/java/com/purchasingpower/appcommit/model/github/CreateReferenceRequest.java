package com.purchasingpower.appcommit.model.github;

/**
 * https://docs.github.com/en/rest/git/refs#create-a-reference
 *
 * @param ref fully qualified, e.g. {@code refs/heads/main}
 */
public record CreateReferenceRequest(String ref, String sha) {
}
