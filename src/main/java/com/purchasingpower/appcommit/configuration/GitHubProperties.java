package com.purchasingpower.appcommit.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;

@Data
public class GitHubProperties {

    @NotNull(message = "GitHub App id is required (APPCOMMIT_GITHUB_APP_ID)")
    @Positive
    private Long appId;

    @NotNull(message = "GitHub App installation id is required (APPCOMMIT_GITHUB_APP_INSTALLATION_ID)")
    @Positive
    private Long installationId;

    @ToString.Exclude
    @NotBlank(message = "GitHub App private key is required (APPCOMMIT_GITHUB_APP_PRIVATE_KEY_PEM_DATA)")
    private String privateKeyPem;

    @NotBlank
    private String apiBaseUrl = "https://api.github.com";

    @NotBlank
    private String apiVersion = "2022-11-28";

    /**
     * GitHub rejects requests without a User-Agent.
     */
    @NotBlank
    private String userAgent = "app-commit";

    @NotNull
    private CommitStrategy commitStrategy = CommitStrategy.TREE;

    @NotNull
    private Duration tokenTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration requestTimeout = Duration.ofSeconds(60);

    @NotNull
    private Duration tokenRenewalMargin = Duration.ofMinutes(2);

    /**
     * Optional; parsed from the configured remote when blank.
     */
    private String repoOwner;

    private String repoName;

    public String graphqlUrl() {
        return apiBaseUrl + "/graphql";
    }

    public enum CommitStrategy {
        /** blob → tree → commit → ref REST sequence */
        TREE,
        /** single createCommitOnBranch GraphQL mutation */
        FILE_CHANGES
    }
}
