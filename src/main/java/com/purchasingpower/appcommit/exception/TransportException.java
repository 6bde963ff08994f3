package com.purchasingpower.appcommit.exception;

public class TransportException extends CommitPipelineException {

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
