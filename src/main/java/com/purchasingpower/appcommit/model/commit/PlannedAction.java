package com.purchasingpower.appcommit.model.commit;

import com.purchasingpower.appcommit.model.git.PathChange;

/**
 * A commit action bound to the path it applies to.
 * For {@link CommitAction#DELETE_ORIGINAL_PATH} the target is the change's original path.
 */
public record PlannedAction(CommitAction action, String targetPath, PathChange change) {
}
