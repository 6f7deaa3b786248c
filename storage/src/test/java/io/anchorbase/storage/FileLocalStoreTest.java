package io.anchorbase.storage;

import io.anchorbase.core.Anchor;
import io.anchorbase.core.AnchorEvent;
import io.anchorbase.core.MetadataValue;
import io.anchorbase.core.Transform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class FileLocalStoreTest {

    @TempDir Path baseDir;

    private static final Instant T0 = Instant.parse("2024-02-02T12:00:00Z");

    private static Anchor anchor(UUID spaceId, long secondsAfterT0) {
        return Anchor.create(UUID.randomUUID(), spaceId, Transform.translation(secondsAfterT0, 0, 0),
                Map.of("label", MetadataValue.of("a" + secondsAfterT0)), T0.plusSeconds(secondsAfterT0));
    }

    private static StoredSpace space(String name, long secondsAfterT0) {
        Instant at = T0.plusSeconds(secondsAfterT0);
        return new StoredSpace(UUID.randomUUID(), name, new byte[]{1, 2, 3, 4}, false, at, at);
    }

    @Test
    void space_record_survives_restart() {
        var store = new FileLocalStore(baseDir);
        StoredSpace s = space("kitchen", 0);
        store.saveSpace(s);

        var reopened = new FileLocalStore(baseDir);
        assertEquals(s, reopened.loadSpace(s.id()).orElseThrow());
        assertTrue(reopened.loadSpace(UUID.randomUUID()).isEmpty());
        assertTrue(Files.exists(baseDir.resolve("spaces").resolve(s.id() + ".rec")));
    }

    @Test
    void save_replaces_previous_record_without_leaving_temp_files() throws Exception {
        var store = new FileLocalStore(baseDir);
        Anchor a = anchor(UUID.randomUUID(), 0);
        store.saveAnchor(a);
        Anchor moved = a.withTransform(Transform.translation(9, 9, 9), T0.plusSeconds(60));
        store.saveAnchor(moved);

        assertEquals(moved, store.loadAnchor(a.id()).orElseThrow());
        try (var files = Files.list(baseDir.resolve("anchors"))) {
            assertEquals(List.of(a.id() + ".rec"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void modified_since_filters_strictly_after() {
        var store = new FileLocalStore(baseDir);
        UUID spaceId = UUID.randomUUID();
        Anchor old = anchor(spaceId, 0);
        Anchor fresh = anchor(spaceId, 10);
        store.saveAnchor(old);
        store.saveAnchor(fresh);
        store.saveSpace(space("s", 10));

        assertEquals(List.of(fresh.id()),
                store.loadAnchorsModifiedSince(T0).stream().map(Anchor::id).toList());
        assertTrue(store.loadSpacesModifiedSince(T0.plusSeconds(10)).isEmpty());
        assertEquals(1, store.loadSpacesModifiedSince(T0).size());
    }

    @Test
    void deleting_space_cascades_to_anchor_records_but_keeps_events() {
        var store = new FileLocalStore(baseDir);
        StoredSpace s = space("lab", 0);
        store.saveSpace(s);
        Anchor mine = anchor(s.id(), 1);
        Anchor other = anchor(UUID.randomUUID(), 2);
        store.saveAnchor(mine);
        store.saveAnchor(other);
        store.appendEvent(AnchorEvent.created(mine, 1, mine.createdAt()));

        store.deleteSpace(s.id());

        assertTrue(store.loadSpace(s.id()).isEmpty());
        assertTrue(store.loadAnchor(mine.id()).isEmpty());
        assertTrue(store.loadAnchor(other.id()).isPresent());
        assertEquals(1, store.loadEvents(s.id()).size());
    }

    @Test
    void purge_removes_only_anchors_deleted_strictly_before_cutoff() {
        var store = new FileLocalStore(baseDir);
        UUID spaceId = UUID.randomUUID();
        Anchor early = anchor(spaceId, 0).markDeleted(T0.plusSeconds(5));
        Anchor atCutoff = anchor(spaceId, 0).markDeleted(T0.plusSeconds(10));
        Anchor live = anchor(spaceId, 0);
        store.saveAnchor(early);
        store.saveAnchor(atCutoff);
        store.saveAnchor(live);
        store.appendEvent(AnchorEvent.created(early, 1, T0));

        assertEquals(1, store.purgeDeletedAnchors(T0.plusSeconds(10)));
        assertEquals(Set.of(atCutoff.id(), live.id()),
                Set.copyOf(store.loadAnchors(spaceId).stream().map(Anchor::id).toList()));
        assertEquals(1, store.loadEventsForAnchor(early.id()).size());
    }

    @Test
    void current_version_and_event_queries() {
        var store = new FileLocalStore(baseDir);
        UUID spaceId = UUID.randomUUID();
        Anchor a = anchor(spaceId, 0);
        assertEquals(0, store.currentVersion(a.id(), spaceId));

        store.appendEvent(AnchorEvent.created(a, 1, T0));
        store.appendEvent(AnchorEvent.moved(a, 2, T0.plusSeconds(30)));

        assertEquals(2, store.currentVersion(a.id(), spaceId));
        assertEquals(List.of(1, 2), store.loadEventsForAnchor(a.id()).stream().map(AnchorEvent::version).toList());
        assertEquals(1, store.loadEventsSince(T0).size());
    }

    @Test
    void queues_and_sync_state_round_trip_through_disk() {
        var store = new FileLocalStore(baseDir);
        assertTrue(store.loadPendingOperations().isEmpty());
        assertTrue(store.lastSyncDate().isEmpty());

        var op = PendingOperation.create(OperationKind.SAVE_ANCHOR, UUID.randomUUID(), T0).retried();
        store.savePendingOperations(List.of(op));
        store.saveDroppedOperations(List.of(op.retried()));
        store.recordLastSync(T0);

        var reopened = new FileLocalStore(baseDir);
        assertEquals(List.of(op), reopened.loadPendingOperations());
        assertEquals(2, reopened.loadDroppedOperations().get(0).retryCount());
        assertEquals(T0, reopened.lastSyncDate().orElseThrow());
    }

    @Test
    void clear_all_removes_everything_including_sync_state() {
        var store = new FileLocalStore(baseDir);
        StoredSpace s = space("x", 0);
        store.saveSpace(s);
        Anchor a = anchor(s.id(), 0);
        store.saveAnchor(a);
        store.appendEvent(AnchorEvent.created(a, 1, T0));
        store.recordLastSync(T0);
        assertTrue(store.totalSize() > 0);

        store.clearAll();

        assertEquals(0, store.totalSize());
        assertTrue(store.loadAllSpaces().isEmpty());
        assertTrue(store.loadEvents(s.id()).isEmpty());
        assertTrue(store.lastSyncDate().isEmpty());

        store.saveAnchor(a);
        store.appendEvent(AnchorEvent.created(a, 1, T0));
        assertEquals(1, store.loadEvents(s.id()).size());
    }

    @Test
    void damaged_record_file_is_reported_not_misread() throws Exception {
        var store = new FileLocalStore(baseDir);
        Anchor a = anchor(UUID.randomUUID(), 0);
        store.saveAnchor(a);
        Path file = baseDir.resolve("anchors").resolve(a.id() + ".rec");
        byte[] bytes = Files.readAllBytes(file);
        bytes[bytes.length - 2] ^= 0x20;
        Files.write(file, bytes);

        assertThrows(UncheckedIOException.class, () -> store.loadAnchor(a.id()));
    }
}
