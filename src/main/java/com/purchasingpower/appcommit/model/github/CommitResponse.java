package com.purchasingpower.appcommit.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CommitResponse(String sha, @JsonProperty("html_url") String htmlUrl) {
}
