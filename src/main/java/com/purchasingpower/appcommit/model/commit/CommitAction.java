package com.purchasingpower.appcommit.model.commit;

public enum CommitAction {
    ADD_PATH,
    DELETE_ORIGINAL_PATH,
    DELETE_PATH,
    NOP,
    UNSUPPORTED;

    public boolean isDeletion() {
        return this == DELETE_PATH || this == DELETE_ORIGINAL_PATH;
    }
}
