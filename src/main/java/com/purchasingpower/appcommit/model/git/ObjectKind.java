package com.purchasingpower.appcommit.model.git;

public enum ObjectKind {
    BLOB,
    TREE,
    COMMIT
}
