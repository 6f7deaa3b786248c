package io.anchorbase.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Difference between the visible anchors of a space at two instants.
 * <p>
 * The five lists are disjoint by anchor id:
 *  - added:     present at toDate only
 *  - removed:   present at fromDate only
 *  - moved:     present at both, transform differs (wins over a metadata change)
 *  - updated:   present at both, same transform, metadata differs
 *  - unchanged: present at both, identical transform and metadata
 */
public record Diff(
        UUID spaceId,
        Instant fromDate,
        Instant toDate,
        List<Anchor> added,
        List<Anchor> removed,
        List<MovedAnchor> moved,
        List<UpdatedAnchor> updated,
        List<Anchor> unchanged
) {

    public Diff {
        Objects.requireNonNull(spaceId, "spaceId");
        Objects.requireNonNull(fromDate, "fromDate");
        Objects.requireNonNull(toDate, "toDate");
        added = List.copyOf(added);
        removed = List.copyOf(removed);
        moved = List.copyOf(moved);
        updated = List.copyOf(updated);
        unchanged = List.copyOf(unchanged);
    }

    /** Anchor whose transform changed; {@code anchor} is the state at toDate. */
    public record MovedAnchor(Anchor anchor, Transform previousTransform) {
        public Position previousPosition() { return previousTransform.position(); }

        public Position currentPosition() { return anchor.position(); }

        /** Straight-line distance between the two positions, in metres. */
        public double distanceMoved() { return previousPosition().distanceTo(currentPosition()); }
    }

    /** Anchor whose metadata changed; {@code anchor} is the state at toDate. */
    public record UpdatedAnchor(Anchor anchor, Map<String, MetadataValue> previousMetadata) {
        public UpdatedAnchor {
            previousMetadata = MetadataValue.copyOrdered(previousMetadata);
        }

        public Set<String> addedKeys() {
            var keys = new HashSet<>(anchor.metadata().keySet());
            keys.removeAll(previousMetadata.keySet());
            return keys;
        }

        public Set<String> removedKeys() {
            var keys = new HashSet<>(previousMetadata.keySet());
            keys.removeAll(anchor.metadata().keySet());
            return keys;
        }

        public Set<String> changedKeys() {
            var keys = new HashSet<String>();
            for (var e : anchor.metadata().entrySet()) {
                var before = previousMetadata.get(e.getKey());
                if (before != null && !before.equals(e.getValue())) {
                    keys.add(e.getKey());
                }
            }
            return keys;
        }
    }

    /**
     * Classify two reconstructed states by anchor id.
     * Output order follows the order of {@code toState} (and {@code fromState} for removals).
     */
    public static Diff compute(UUID spaceId, Instant fromDate, Instant toDate,
                               List<Anchor> fromState, List<Anchor> toState) {
        Map<UUID, Anchor> before = index(fromState);
        Map<UUID, Anchor> after = index(toState);

        List<Anchor> added = new ArrayList<>();
        List<MovedAnchor> moved = new ArrayList<>();
        List<UpdatedAnchor> updated = new ArrayList<>();
        List<Anchor> unchanged = new ArrayList<>();

        for (Anchor now : after.values()) {
            Anchor then = before.get(now.id());
            if (then == null) {
                added.add(now);
            } else if (!then.transform().equals(now.transform())) {
                moved.add(new MovedAnchor(now, then.transform()));
            } else if (!then.metadata().equals(now.metadata())) {
                updated.add(new UpdatedAnchor(now, then.metadata()));
            } else {
                unchanged.add(now);
            }
        }

        List<Anchor> removed = new ArrayList<>();
        for (Anchor then : before.values()) {
            if (!after.containsKey(then.id())) {
                removed.add(then);
            }
        }

        return new Diff(spaceId, fromDate, toDate, added, removed, moved, updated, unchanged);
    }

    public int changeCount() {
        return added.size() + removed.size() + moved.size() + updated.size();
    }

    public boolean hasChanges() { return changeCount() > 0; }

    /** Every anchor visible at toDate. */
    public List<Anchor> currentAnchors() {
        List<Anchor> out = new ArrayList<>(added);
        moved.forEach(m -> out.add(m.anchor()));
        updated.forEach(u -> out.add(u.anchor()));
        out.addAll(unchanged);
        return out;
    }

    /** Every anchor id visible at fromDate; moved/updated entries carry their toDate state. */
    public List<Anchor> previousAnchors() {
        List<Anchor> out = new ArrayList<>(removed);
        moved.forEach(m -> out.add(m.anchor()));
        updated.forEach(u -> out.add(u.anchor()));
        out.addAll(unchanged);
        return out;
    }

    /** Short human-readable summary, e.g. "2 added, 1 moved". */
    public String summary() {
        List<String> parts = new ArrayList<>();
        if (!added.isEmpty()) parts.add(added.size() + " added");
        if (!removed.isEmpty()) parts.add(removed.size() + " removed");
        if (!moved.isEmpty()) parts.add(moved.size() + " moved");
        if (!updated.isEmpty()) parts.add(updated.size() + " updated");
        return parts.isEmpty() ? "No changes" : String.join(", ", parts);
    }

    private static Map<UUID, Anchor> index(List<Anchor> anchors) {
        Map<UUID, Anchor> m = new LinkedHashMap<>(anchors.size() * 2);
        for (Anchor a : anchors) m.put(a.id(), a);
        return m;
    }
}
