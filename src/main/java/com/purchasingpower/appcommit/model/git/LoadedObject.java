package com.purchasingpower.appcommit.model.git;

/**
 * Raw object read from the local object database by id.
 */
public record LoadedObject(String id, ObjectKind kind, byte[] bytes) {
}
