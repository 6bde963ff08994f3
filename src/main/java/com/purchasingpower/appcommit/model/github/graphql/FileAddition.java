package com.purchasingpower.appcommit.model.github.graphql;

/**
 * @param contents base64 encoded file contents
 */
public record FileAddition(String path, String contents) {
}
