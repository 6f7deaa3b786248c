package io.anchorbase.core;

import java.util.Objects;

/**
 * Single-step reducer shared by timeline reconstruction and version rollback.
 * <p>
 * Given the folded state so far (or null when nothing is known about the anchor yet)
 * and the next event, return the new state. Events other than CREATED that arrive
 * before any CREATED are dropped: partial or filtered event sets simply yield no entry.
 */
final class AnchorFold {

    /** Folded anchor plus the internal "currently deleted" flag. */
    record State(Anchor anchor, boolean inactive) {}

    private AnchorFold() {
        // utility
    }

    static State apply(State current, AnchorEvent e) {
        if (e.type() == EventType.CREATED) {
            var seeded = new Anchor(e.anchorId(), e.spaceId(), e.transform(),
                    e.metadata(), e.timestamp(), e.timestamp(), null);
            return new State(seeded, false);
        }
        if (current == null) {
            return null;
        }
        Anchor a = current.anchor();
        return switch (e.type()) {
            case MOVED -> new State(a.withTransform(
                    Objects.requireNonNullElse(e.transform(), a.transform()), e.timestamp()), current.inactive());
            case UPDATED -> new State(a.withMetadata(
                    Objects.requireNonNullElse(e.metadata(), a.metadata()), e.timestamp()), current.inactive());
            case DELETED -> new State(a.markDeleted(e.timestamp()), true);
            case RESTORED -> new State(new Anchor(
                    a.id(),
                    a.spaceId(),
                    Objects.requireNonNullElse(e.transform(), a.transform()),
                    Objects.requireNonNullElse(e.metadata(), a.metadata()),
                    a.createdAt(),
                    e.timestamp(),
                    null), false);
            case CREATED -> throw new IllegalStateException("unreachable");
        };
    }
}
