package com.purchasingpower.appcommit.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record TreeResponse(String sha, String url, boolean truncated) {
}
