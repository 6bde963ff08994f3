package com.purchasingpower.appcommit.model.github;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GitHubNodeType {
    BLOB("blob"),
    TREE("tree"),
    COMMIT("commit");

    private final String wireValue;

    GitHubNodeType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
