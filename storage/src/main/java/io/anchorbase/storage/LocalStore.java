package io.anchorbase.storage;

import io.anchorbase.core.Anchor;
import io.anchorbase.core.AnchorEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable local persistence for spaces, anchors, events, the retry queue and sync state.
 * <p>
 * Semantics:
 *  - Record writes replace the previous record atomically.
 *  - Lookups of unknown ids return {@link Optional#empty()}.
 *  - The event log is append-only; nothing here rewrites or removes events except
 *    {@link #clearAll()}.
 *  - Single writer: implementations need not guard against other processes.
 */
public interface LocalStore {

    // spaces

    void saveSpace(StoredSpace space);

    Optional<StoredSpace> loadSpace(UUID id);

    List<StoredSpace> loadAllSpaces();

    List<StoredSpace> loadSpacesModifiedSince(Instant since);

    /** Remove the space record and every anchor record that belongs to it. Events stay. */
    void deleteSpace(UUID id);

    // anchors

    void saveAnchor(Anchor anchor);

    Optional<Anchor> loadAnchor(UUID id);

    /** Every anchor record of a space, soft-deleted ones included. */
    List<Anchor> loadAnchors(UUID spaceId);

    List<Anchor> loadAllAnchors();

    List<Anchor> loadAnchorsModifiedSince(Instant since);

    void deleteAnchorRecord(UUID id);

    /**
     * Hard-delete anchor records whose deletedAt is strictly before {@code before}.
     *
     * @return number of records removed
     */
    int purgeDeletedAnchors(Instant before);

    // events

    void appendEvent(AnchorEvent event);

    /** Events of a space in append order. */
    List<AnchorEvent> loadEvents(UUID spaceId);

    /** Events of one anchor in version order. */
    List<AnchorEvent> loadEventsForAnchor(UUID anchorId);

    /** Events of all spaces with timestamp strictly after {@code since}. */
    List<AnchorEvent> loadEventsSince(Instant since);

    /** Highest version recorded for the anchor, 0 when it has no events. */
    int currentVersion(UUID anchorId, UUID spaceId);

    // retry queue

    void savePendingOperations(List<PendingOperation> operations);

    List<PendingOperation> loadPendingOperations();

    void saveDroppedOperations(List<PendingOperation> operations);

    List<PendingOperation> loadDroppedOperations();

    // sync state

    Optional<Instant> lastSyncDate();

    void recordLastSync(Instant at);

    // housekeeping

    /** Bytes used on disk. */
    long totalSize();

    /** Remove every record, log, queue and the sync state. */
    void clearAll();
}
