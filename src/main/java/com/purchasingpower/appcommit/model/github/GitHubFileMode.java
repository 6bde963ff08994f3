package com.purchasingpower.appcommit.model.github;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * File modes accepted by the create-a-tree endpoint.
 */
public enum GitHubFileMode {
    BLOB("100644"),
    EXECUTABLE("100755"),
    SUBMODULE("160000"),
    SYMLINK("120000"),
    SUBDIRECTORY("040000");

    private final String wireValue;

    GitHubFileMode(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
