package com.purchasingpower.appcommit.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ReferenceResponse(String ref, String url, GitObject object) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GitObject(String sha, String type, String url) {
    }
}
