package io.anchorbase.storage;

/** Remote action a pending operation will replay. */
public enum OperationKind {
    SAVE_SPACE,
    DELETE_SPACE,
    SAVE_ANCHOR
}
