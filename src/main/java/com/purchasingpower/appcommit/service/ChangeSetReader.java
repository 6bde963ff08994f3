package com.purchasingpower.appcommit.service;

import com.purchasingpower.appcommit.model.git.PathChange;

import java.util.List;

public interface ChangeSetReader {

    /**
     * Changes staged since the last commit, sorted by path.
     *
     * @throws com.purchasingpower.appcommit.exception.PreconditionException if the index has unresolved conflicts
     */
    List<PathChange> readChanges();
}
