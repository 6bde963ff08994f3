package com.purchasingpower.appcommit.service;

import com.purchasingpower.appcommit.model.commit.ResolvedContent;
import com.purchasingpower.appcommit.model.git.PathChange;

public interface ContentResolver {

    /**
     * Reads the staged blob of a change by its content id.
     *
     * @throws com.purchasingpower.appcommit.exception.ContentException if the id is missing, the object
     *         cannot be found, or it is not a blob
     */
    ResolvedContent resolve(PathChange change);
}
