package com.purchasingpower.appcommit.repository;

import com.purchasingpower.appcommit.model.git.LoadedObject;
import com.purchasingpower.appcommit.model.git.PathChange;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of the local repository the commit is built from.
 */
public interface LocalGitRepository {

    /**
     * Path-level changes from the HEAD commit's tree to the staged index, in no particular order.
     *
     * @throws com.purchasingpower.appcommit.exception.PreconditionException if HEAD does not resolve to a commit
     */
    List<PathChange> diffHeadToIndex();

    /**
     * Looks an object up by its hex id in the object database, never in the working tree.
     */
    Optional<LoadedObject> readObject(String objectId);

    /**
     * Short name of the checked out branch; empty when HEAD is detached.
     */
    Optional<String> currentBranchName();

    Optional<String> headCommitId();

    /**
     * Paths with index entries at a non-zero stage, sorted.
     */
    List<String> conflictedPaths();

    default boolean indexHasConflicts() {
        return !conflictedPaths().isEmpty();
    }

    /**
     * Push URL of the remote, falling back to its fetch URL.
     */
    Optional<String> remoteUrl(String remoteName);
}
