package com.purchasingpower.appcommit.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GitProperties {

    /**
     * Working tree (or any directory inside it) of the local repository.
     */
    @NotBlank
    private String repoPath = ".";

    /**
     * Remote whose URL identifies the GitHub repository when owner/name are not configured.
     */
    @NotBlank
    private String remoteName = "origin";

    private boolean detectRenames = true;
}
