package com.purchasingpower.appcommit.exception;

public class PreconditionException extends CommitPipelineException {

    public PreconditionException(String message) {
        super(message);
    }

    public PreconditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
