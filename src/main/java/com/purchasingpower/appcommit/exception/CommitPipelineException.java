package com.purchasingpower.appcommit.exception;

/**
 * Root of every failure raised while turning staged changes into a GitHub commit.
 * All of them are terminal for the current run; the message is shown to the operator verbatim.
 */
public class CommitPipelineException extends RuntimeException {

    public CommitPipelineException(String message) {
        super(message);
    }

    public CommitPipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
