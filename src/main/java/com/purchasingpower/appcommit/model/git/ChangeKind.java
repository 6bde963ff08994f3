package com.purchasingpower.appcommit.model.git;

/**
 * Status of a single path between the last commit and the staged index.
 */
public enum ChangeKind {
    ADDED,
    MODIFIED,
    DELETED,
    RENAMED,
    COPIED,
    /** blob to symlink, symlink to submodule, ... */
    TYPE_CHANGED,
    UNMODIFIED,
    IGNORED,
    UNTRACKED,
    UNREADABLE,
    CONFLICTED
}
