package com.purchasingpower.appcommit.model.github;

/**
 * Where the data of a tree node comes from: inline text or an existing object id.
 * A {@link Kind#SHA} source with a null sha removes the path from the tree.
 */
public final class TreeNodeSource {

    public enum Kind {
        CONTENT,
        SHA
    }

    private static final TreeNodeSource DELETION = new TreeNodeSource(Kind.SHA, null);

    private final Kind kind;
    private final String value;

    private TreeNodeSource(Kind kind, String value) {
        this.kind = kind;
        this.value = value;
    }

    public static TreeNodeSource content(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Inline content must not be null");
        }
        return new TreeNodeSource(Kind.CONTENT, text);
    }

    public static TreeNodeSource sha(String sha) {
        if (sha == null || sha.isBlank()) {
            throw new IllegalArgumentException("Object sha must not be blank; use deletion() to remove a path");
        }
        return new TreeNodeSource(Kind.SHA, sha);
    }

    public static TreeNodeSource deletion() {
        return DELETION;
    }

    public Kind getKind() {
        return kind;
    }

    public String getValue() {
        return value;
    }

    public boolean isDeletion() {
        return kind == Kind.SHA && value == null;
    }

    @Override
    public String toString() {
        if (isDeletion()) {
            return "sha=null";
        }
        return kind == Kind.SHA ? "sha=" + value : "content(" + value.length() + " chars)";
    }
}
