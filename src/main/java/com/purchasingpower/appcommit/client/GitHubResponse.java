package com.purchasingpower.appcommit.client;

/**
 * Status and raw body of a GitHub response.
 *
 * @param body the body as text, or null when it was not valid UTF-8
 */
public record GitHubResponse(int statusCode, String body) {
}
