package com.purchasingpower.appcommit.exception;

import lombok.Getter;

/**
 * A local change that cannot be expressed through the GitHub API.
 */
@Getter
public class MappingException extends CommitPipelineException {

    private final String path;

    public MappingException(String path, String message) {
        super(message);
        this.path = path;
    }
}
