package io.anchorbase.engine.remote;

import io.anchorbase.core.Anchor;
import io.anchorbase.core.AnchorEvent;
import io.anchorbase.storage.StoredSpace;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, process-local {@link RemoteStore}. Backs the replica server and tests.
 */
public final class InMemoryRemoteStore implements RemoteStore {
    private final Map<UUID, StoredSpace> spaces = new ConcurrentHashMap<>();
    private final Map<UUID, Anchor> anchors = new ConcurrentHashMap<>();
    private final Map<UUID, AnchorEvent> events = new ConcurrentHashMap<>();

    @Override public void uploadSpace(StoredSpace space) { spaces.put(space.id(), space); }

    @Override public Optional<StoredSpace> downloadSpace(UUID id) { return Optional.ofNullable(spaces.get(id)); }

    @Override
    public List<StoredSpace> listSpacesModifiedSince(Instant since) {
        return spaces.values().stream()
                .filter(s -> s.updatedAt().isAfter(since))
                .sorted(Comparator.comparing(StoredSpace::updatedAt))
                .toList();
    }

    @Override
    public void deleteSpace(UUID id) {
        spaces.remove(id);
        anchors.values().removeIf(a -> a.spaceId().equals(id));
    }

    @Override public void uploadAnchor(Anchor anchor) { anchors.put(anchor.id(), anchor); }

    @Override public Optional<Anchor> downloadAnchor(UUID id) { return Optional.ofNullable(anchors.get(id)); }

    @Override
    public List<Anchor> listAnchorsModifiedSince(Instant since) {
        return anchors.values().stream()
                .filter(a -> a.updatedAt().isAfter(since))
                .sorted(Comparator.comparing(Anchor::updatedAt))
                .toList();
    }

    @Override public void deleteAnchor(UUID id) { anchors.remove(id); }

    @Override
    public void purgeDeletedAnchors(Instant before) {
        anchors.values().removeIf(a -> a.deletedAt() != null && a.deletedAt().isBefore(before));
    }

    @Override public void uploadEvent(AnchorEvent event) { events.put(event.id(), event); }

    @Override
    public List<AnchorEvent> listEventsSince(Instant since) {
        List<AnchorEvent> out = new ArrayList<>();
        for (AnchorEvent e : events.values()) {
            if (e.timestamp().isAfter(since)) out.add(e);
        }
        out.sort(Comparator.comparing(AnchorEvent::timestamp).thenComparingInt(AnchorEvent::version));
        return out;
    }

    @Override
    public List<AnchorEvent> listEventsForAnchor(UUID anchorId) {
        return events.values().stream()
                .filter(e -> e.anchorId().equals(anchorId))
                .sorted(Comparator.comparingInt(AnchorEvent::version).thenComparing(AnchorEvent::timestamp))
                .toList();
    }

    @Override
    public void deleteEventsOlderThan(Instant cutoff) {
        events.values().removeIf(e -> e.timestamp().isBefore(cutoff));
    }

    public int spaceCount() { return spaces.size(); }

    public int anchorCount() { return anchors.size(); }

    public int eventCount() { return events.size(); }
}
