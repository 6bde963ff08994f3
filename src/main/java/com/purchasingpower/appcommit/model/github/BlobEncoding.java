package com.purchasingpower.appcommit.model.github;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BlobEncoding {
    UTF_8("utf-8"),
    BASE64("base64");

    private final String wireValue;

    BlobEncoding(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }
}
