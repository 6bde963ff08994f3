package com.purchasingpower.appcommit.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Abbreviated body of https://docs.github.com/en/rest/apps/apps#create-an-installation-access-token-for-an-app
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccessTokenResponse(String token, @JsonProperty("expires_at") String expiresAt) {
}
