package com.purchasingpower.appcommit.model.commit;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;

/**
 * Staged file content, either valid UTF-8 text or base64 of arbitrary bytes.
 */
public final class ResolvedContent {

    public enum Encoding {
        TEXT,
        BINARY
    }

    private final Encoding encoding;
    private final String value;

    private ResolvedContent(Encoding encoding, String value) {
        this.encoding = Objects.requireNonNull(encoding);
        this.value = Objects.requireNonNull(value);
    }

    public static ResolvedContent text(String text) {
        return new ResolvedContent(Encoding.TEXT, text);
    }

    public static ResolvedContent binary(String base64) {
        return new ResolvedContent(Encoding.BINARY, base64);
    }

    public Encoding getEncoding() {
        return encoding;
    }

    public boolean isText() {
        return encoding == Encoding.TEXT;
    }

    /**
     * The literal text for {@link Encoding#TEXT}, the base64 string for {@link Encoding#BINARY}.
     */
    public String getValue() {
        return value;
    }

    public String toBase64() {
        return isText()
                ? Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8))
                : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedContent other)) return false;
        return encoding == other.encoding && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(encoding, value);
    }

    @Override
    public String toString() {
        return encoding + "(" + value.length() + " chars)";
    }
}
