package com.purchasingpower.appcommit.exception;

import lombok.Getter;

/**
 * GitHub accepted the request but reported errors in the GraphQL response.
 */
@Getter
public class RemoteOperationException extends CommitPipelineException {

    private final String errors;

    public RemoteOperationException(String errors) {
        super("Errors were encountered: " + errors);
        this.errors = errors;
    }
}
