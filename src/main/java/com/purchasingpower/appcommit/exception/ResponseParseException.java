package com.purchasingpower.appcommit.exception;

import lombok.Getter;

@Getter
public class ResponseParseException extends CommitPipelineException {

    private final String responseBody;

    public ResponseParseException(String operation, String responseBody, Throwable cause) {
        super("Unable to parse response while " + operation + ": " + responseBody, cause);
        this.responseBody = responseBody;
    }
}
