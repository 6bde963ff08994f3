package com.purchasingpower.appcommit.exception;

import lombok.Getter;

@Getter
public class UnexpectedStatusException extends CommitPipelineException {

    private final int statusCode;
    private final String responseBody;

    public UnexpectedStatusException(String operation, int expectedStatus, int statusCode, String responseBody) {
        super(responseBody != null
                ? String.format("Unexpected status code %d (expected %d) while %s: %s",
                        statusCode, expectedStatus, operation, responseBody)
                : String.format("Unexpected status code %d (expected %d) while %s; body could not be decoded as text",
                        statusCode, expectedStatus, operation));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }
}
