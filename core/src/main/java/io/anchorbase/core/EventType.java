package io.anchorbase.core;

/**
 * Kind of state transition recorded by an {@link AnchorEvent}.
 * <p>
 * Field presence per type:
 *  - CREATED:  transform + metadata
 *  - MOVED:    transform
 *  - UPDATED:  metadata
 *  - DELETED:  neither
 *  - RESTORED: transform + metadata
 */
public enum EventType {
    CREATED, MOVED, UPDATED, DELETED, RESTORED;

    public boolean carriesTransform() {
        return switch (this) {
            case CREATED, MOVED, RESTORED -> true;
            default -> false;
        };
    }

    public boolean carriesMetadata() {
        return switch (this) {
            case CREATED, UPDATED, RESTORED -> true;
            default -> false;
        };
    }
}
