package com.purchasingpower.appcommit.model.git;

/**
 * One changed path between HEAD and the index.
 *
 * @param kind         what happened to the path
 * @param mode         staged file mode ({@link LocalFileMode#UNREADABLE} for deletions)
 * @param contentId    hex id of the staged object, null when nothing is staged at {@code path}
 * @param objectKind   kind of the staged object, null when it could not be resolved
 * @param path         path after the change
 * @param originalPath source path of a rename or copy; the same as {@code path} or null otherwise
 */
public record PathChange(
        ChangeKind kind,
        LocalFileMode mode,
        String contentId,
        ObjectKind objectKind,
        String path,
        String originalPath
) {
    public static PathChange deleted(String path) {
        return new PathChange(ChangeKind.DELETED, LocalFileMode.UNREADABLE, null, null, path, path);
    }
}
