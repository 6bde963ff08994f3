package com.purchasingpower.appcommit.model.github.graphql;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommitMessage(String headline, String body) {

    /**
     * First line becomes the headline; the trimmed remainder becomes the body, or null when empty.
     */
    public static CommitMessage fromText(String message) {
        String text = message == null ? "" : message;
        int newline = text.indexOf('\n');
        if (newline < 0) {
            return new CommitMessage(stripCarriageReturn(text), null);
        }
        String headline = stripCarriageReturn(text.substring(0, newline));
        String body = text.substring(newline + 1).trim();
        return new CommitMessage(headline, body.isEmpty() ? null : body);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
