package com.purchasingpower.appcommit.exception;

import lombok.Getter;

@Getter
public class ContentException extends CommitPipelineException {

    private final String path;

    public ContentException(String path, String message) {
        super(message);
        this.path = path;
    }

    public ContentException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }
}
