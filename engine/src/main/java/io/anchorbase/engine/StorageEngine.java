package io.anchorbase.engine;

import io.anchorbase.core.Anchor;
import io.anchorbase.core.AnchorEvent;
import io.anchorbase.core.AnchorReconstruction;
import io.anchorbase.core.ConflictResolver;
import io.anchorbase.core.Diff;
import io.anchorbase.core.EventType;
import io.anchorbase.core.Space;
import io.anchorbase.core.Timeline;
import io.anchorbase.core.error.CloudNotConfiguredException;
import io.anchorbase.core.error.CloudSyncFailedException;
import io.anchorbase.core.error.InvalidReferenceException;
import io.anchorbase.core.error.NotFoundException;
import io.anchorbase.core.error.VersionNotFoundException;
import io.anchorbase.engine.remote.RemoteStore;
import io.anchorbase.engine.remote.RemoteStoreException;
import io.anchorbase.storage.CompressionCodec;
import io.anchorbase.storage.CompressionLevel;
import io.anchorbase.storage.LocalStore;
import io.anchorbase.storage.OperationKind;
import io.anchorbase.storage.PendingOperation;
import io.anchorbase.storage.StoredSpace;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for persisting spaces and anchors.
 * <p>
 * Responsibilities:
 *  - Always write to the {@link LocalStore} first; the local write stands even when a
 *    remote push fails.
 *  - Turn every classifiable anchor change into exactly one {@link AnchorEvent} with the
 *    next per-anchor version.
 *  - Push writes to the {@link RemoteStore} immediately under
 *    {@link StorageConfig.SyncStrategy#ON_SAVE}, queueing failures for {@link #sync()}.
 *  - Reconcile with the remote on {@link #sync()} using last-write-wins.
 * <p>
 * Mutating operations are serialized on the instance. Running two engines against one
 * store directory is not supported.
 */
public class StorageEngine {
    private static final Logger log = Logger.getLogger(StorageEngine.class.getName());

    /** A queued operation is dropped once it has failed this many replays. */
    public static final int MAX_ATTEMPTS = 5;

    /** Lower bound used when the store has never synced. */
    static final Instant NEVER = Instant.EPOCH;

    private final LocalStore local;
    private final RemoteStore remote; // null unless the backend is REMOTE
    private final StorageConfig config;
    private final SpatialPayloadCodec payloadCodec;
    private final CompressionCodec compression;
    private final Clock clock;
    private final ConflictResolver<Anchor> anchorResolver = new ConflictResolver.LastWriteWins<>();
    private final ConflictResolver<StoredSpace> spaceResolver = new ConflictResolver.LastWriteWins<>();

    private final List<PendingOperation> pending;

    /** Local-only engine with default configuration. */
    public StorageEngine(LocalStore local) {
        this(local, null, StorageConfig.defaults());
    }

    public StorageEngine(LocalStore local, RemoteStore remote, StorageConfig config) {
        this(local, remote, config, new OpaquePayloadCodec(), new CompressionCodec(), Clock.systemUTC());
    }

    public StorageEngine(LocalStore local,
                         RemoteStore remote,
                         StorageConfig config,
                         SpatialPayloadCodec payloadCodec,
                         CompressionCodec compression,
                         Clock clock) {
        this.local = Objects.requireNonNull(local, "local");
        this.config = Objects.requireNonNull(config, "config");
        this.payloadCodec = Objects.requireNonNull(payloadCodec, "payloadCodec");
        this.compression = Objects.requireNonNull(compression, "compression");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (config.isRemote() && remote == null) {
            throw new IllegalArgumentException("REMOTE backend requires a RemoteStore");
        }
        this.remote = config.isRemote() ? remote : null;
        this.pending = new ArrayList<>(local.loadPendingOperations());
    }

    public StorageConfig config() { return config; }

    // ---------- spaces ----------

    /** Validate, compress and store a space; push it when syncing on save. */
    public synchronized void save(Space space) {
        byte[] payload = space.payload();
        payloadCodec.validate(payload);
        CompressionLevel level = config.compressionLevel();
        byte[] stored = compression.compress(payload, level);
        StoredSpace record = StoredSpace.of(space, stored, level != CompressionLevel.NONE);

        local.saveSpace(record);
        log.fine(() -> "saved space " + space.id() + ": " + payloadCodec.size(payload) + " -> " + stored.length + " bytes");

        if (pushOnSave()) {
            try {
                remote.uploadSpace(record);
            } catch (RemoteStoreException e) {
                throw queueAndFail(OperationKind.SAVE_SPACE, space.id(), e);
            }
        }
    }

    /**
     * Local copy first, then the remote. A remote copy is cached unless a local
     * write for the same id landed while the remote call was in flight.
     */
    public Optional<Space> loadSpace(UUID id) {
        Optional<StoredSpace> found = local.loadSpace(id);
        if (found.isEmpty() && isCloudEnabled()) {
            Optional<StoredSpace> fetched = remoteRead(() -> remote.downloadSpace(id));
            found = cacheSpace(id, fetched);
        }
        return found.map(this::decode);
    }

    private synchronized Optional<StoredSpace> cacheSpace(UUID id, Optional<StoredSpace> fetched) {
        Optional<StoredSpace> current = local.loadSpace(id);
        if (current.isPresent() || fetched.isEmpty()) {
            return current;
        }
        local.saveSpace(fetched.get());
        log.fine(() -> "cached remote space " + id);
        return fetched;
    }

    public List<Space> loadAllSpaces() {
        return local.loadAllSpaces().stream().map(this::decode).toList();
    }

    /** Delete a space and its anchor records. Events are kept. */
    public synchronized void deleteSpace(UUID id) {
        local.deleteSpace(id);
        if (pushOnSave()) {
            try {
                remote.deleteSpace(id);
            } catch (RemoteStoreException e) {
                throw queueAndFail(OperationKind.DELETE_SPACE, id, e);
            }
        }
    }

    // ---------- anchors ----------

    /**
     * Persist an anchor and record what changed.
     * <p>
     *  1) load the stored record and the current version,
     *  2) migrate a record that predates the event log (synthetic CREATED at its createdAt),
     *  3) classify the change and append at most one event,
     *  4) store the snapshot,
     *  5) push when syncing on save.
     *
     * @return the event appended for this change, if any
     */
    public synchronized Optional<AnchorEvent> save(Anchor anchor) {
        Objects.requireNonNull(anchor, "anchor");
        Optional<Anchor> existing = local.loadAnchor(anchor.id());
        if (existing.isPresent() && !existing.get().spaceId().equals(anchor.spaceId())) {
            throw new InvalidReferenceException("anchor " + anchor.id() + " belongs to space "
                    + existing.get().spaceId() + ", not " + anchor.spaceId());
        }

        Instant now = clock.instant();
        List<AnchorEvent> appended = new ArrayList<>(2);
        AnchorEvent change = null;

        if (existing.isPresent()) {
            Anchor previous = existing.get();
            int version = migrateIfNeeded(previous, appended);
            EventType type = classify(previous, anchor);
            if (type != null) {
                change = AnchorEvent.of(anchor, type, version + 1, now);
            }
        } else {
            change = AnchorEvent.created(anchor, local.currentVersion(anchor.id(), anchor.spaceId()) + 1, now);
        }

        if (change != null) {
            local.appendEvent(change);
            appended.add(change);
        }
        local.saveAnchor(anchor);
        pushAnchor(anchor, appended);
        return Optional.ofNullable(change);
    }

    /** Local copy first, then the remote; a cached remote anchor brings its history along. */
    public Optional<Anchor> loadAnchor(UUID id) {
        Optional<Anchor> found = local.loadAnchor(id);
        if (found.isEmpty() && isCloudEnabled()) {
            Optional<Anchor> fetched = remoteRead(() -> remote.downloadAnchor(id));
            if (fetched.isEmpty()) {
                return fetched;
            }
            List<AnchorEvent> history = remoteRead(() -> remote.listEventsForAnchor(id));
            found = cacheAnchor(fetched.get(), history);
        }
        return found;
    }

    private synchronized Optional<Anchor> cacheAnchor(Anchor fetched, List<AnchorEvent> history) {
        Optional<Anchor> current = local.loadAnchor(fetched.id());
        if (current.isPresent()) {
            return current;
        }
        appendRemoteHistory(fetched.id(), history);
        local.saveAnchor(fetched);
        log.fine(() -> "cached remote anchor " + fetched.id());
        return Optional.of(fetched);
    }

    /** Live anchors of a space. */
    public List<Anchor> loadAnchors(UUID spaceId) {
        return loadAnchors(spaceId, false);
    }

    public List<Anchor> loadAnchors(UUID spaceId, boolean includeDeleted) {
        List<Anchor> all = local.loadAnchors(spaceId);
        return includeDeleted ? all : all.stream().filter(a -> !a.isDeleted()).toList();
    }

    /**
     * Soft-delete an anchor and append a DELETED event.
     * Deleting an anchor that is already deleted changes nothing.
     *
     * @throws NotFoundException when no record exists
     */
    public synchronized Anchor deleteAnchor(UUID id) {
        Anchor existing = local.loadAnchor(id).orElseThrow(() -> new NotFoundException("anchor", id));
        if (existing.isDeleted()) {
            return existing;
        }

        List<AnchorEvent> appended = new ArrayList<>(2);
        int version = migrateIfNeeded(existing, appended);
        Instant now = clock.instant();
        Anchor deleted = existing.markDeleted(now);
        AnchorEvent event = AnchorEvent.deleted(deleted, version + 1, now);

        local.appendEvent(event);
        appended.add(event);
        local.saveAnchor(deleted);
        pushAnchor(deleted, appended);
        return deleted;
    }

    /** Hard-delete anchor records soft-deleted before the cutoff, locally and remotely. No events. */
    public synchronized int purgeDeletedAnchors(Instant before) {
        int purged = local.purgeDeletedAnchors(before);
        if (isCloudEnabled()) {
            try {
                remote.purgeDeletedAnchors(before);
            } catch (RemoteStoreException e) {
                throw new CloudSyncFailedException(e);
            }
        }
        log.fine(() -> "purged " + purged + " deleted anchors older than " + before);
        return purged;
    }

    // ---------- versioning ----------

    /**
     * Restore an anchor to the state it had at {@code toVersion}.
     * History is kept: the restore itself is appended as a RESTORED event.
     *
     * @throws NotFoundException        when the anchor has no events
     * @throws VersionNotFoundException when no event carries that version
     */
    public synchronized Anchor rollback(UUID anchorId, int toVersion) {
        List<AnchorEvent> history = local.loadEventsForAnchor(anchorId);
        if (history.isEmpty()) {
            throw new NotFoundException("anchor", anchorId);
        }
        if (history.stream().noneMatch(e -> e.version() == toVersion)) {
            throw new VersionNotFoundException(anchorId, toVersion);
        }

        Anchor folded = AnchorReconstruction.reconstruct(anchorId, history, toVersion);
        int latest = history.stream().mapToInt(AnchorEvent::version).max().orElse(0);
        Instant now = clock.instant();
        Instant createdAt = local.loadAnchor(anchorId).map(Anchor::createdAt).orElse(folded.createdAt());
        Anchor restored = new Anchor(anchorId, folded.spaceId(), folded.transform(), folded.metadata(),
                createdAt, now, null);
        AnchorEvent event = AnchorEvent.restored(restored, latest + 1, now);

        local.appendEvent(event);
        local.saveAnchor(restored);
        log.info(() -> "Rolled back anchor " + anchorId + " to version " + toVersion + " as version " + event.version());
        pushAnchor(restored, List.of(event));
        return restored;
    }

    /** All events of one anchor in version order. */
    public List<AnchorEvent> history(UUID anchorId) {
        return local.loadEventsForAnchor(anchorId);
    }

    public Timeline timeline(UUID spaceId) {
        return new Timeline(spaceId, local.loadEvents(spaceId));
    }

    public List<Anchor> anchorsAt(UUID spaceId, Instant date) {
        return timeline(spaceId).stateAt(date);
    }

    public Diff diff(UUID spaceId, Instant from, Instant to) {
        return timeline(spaceId).diff(from, to);
    }

    // ---------- sync ----------

    /**
     * Reconcile with the remote.
     * <p>
     *  1) replay the retry queue; operations failing their {@value #MAX_ATTEMPTS}th attempt are dropped,
     *  2) upload local spaces, anchors and events changed since the last sync, plus the whole
     *     history of each uploaded anchor, then record the sync,
     *  3) download remote spaces and anchors changed since the last sync, last write wins;
     *     an adopted anchor also takes the remote events above its local version.
     * <p>
     * Both 2) and 3) use the last-sync instant read at the start of the run.
     *
     * @throws CloudNotConfiguredException when no remote is configured
     * @throws CloudSyncFailedException    when phase 2 or 3 cannot reach the remote
     */
    public synchronized SyncReport sync() {
        if (!isCloudEnabled()) {
            throw new CloudNotConfiguredException();
        }
        Instant since = local.lastSyncDate().orElse(NEVER);

        // 1) retry queue
        int replayed = 0;
        List<PendingOperation> kept = new ArrayList<>();
        List<PendingOperation> dropped = new ArrayList<>();
        for (PendingOperation op : pending) {
            try {
                replay(op);
                replayed++;
            } catch (RemoteStoreException e) {
                PendingOperation failed = op.retried();
                if (failed.retryCount() >= MAX_ATTEMPTS) {
                    log.log(Level.WARNING, "Dropping " + failed.kind() + " for " + failed.targetId()
                            + " after " + failed.retryCount() + " failed attempts", e);
                    dropped.add(failed);
                } else {
                    kept.add(failed);
                }
            }
        }
        pending.clear();
        pending.addAll(kept);
        local.savePendingOperations(List.copyOf(pending));
        if (!dropped.isEmpty()) {
            List<PendingOperation> deadLetters = new ArrayList<>(local.loadDroppedOperations());
            deadLetters.addAll(dropped);
            local.saveDroppedOperations(deadLetters);
        }

        try {
            // 2) upload
            int upSpaces = 0;
            for (StoredSpace s : local.loadSpacesModifiedSince(since)) {
                remote.uploadSpace(s);
                upSpaces++;
            }
            List<Anchor> changedAnchors = local.loadAnchorsModifiedSince(since);
            for (Anchor a : changedAnchors) {
                remote.uploadAnchor(a);
            }
            int upAnchors = changedAnchors.size();
            // events stamped before `since` (migrations) still go out with their anchor
            Map<UUID, AnchorEvent> outgoing = new LinkedHashMap<>();
            for (AnchorEvent e : local.loadEventsSince(since)) {
                outgoing.put(e.id(), e);
            }
            for (Anchor a : changedAnchors) {
                for (AnchorEvent e : local.loadEventsForAnchor(a.id())) {
                    outgoing.putIfAbsent(e.id(), e);
                }
            }
            for (AnchorEvent e : outgoing.values()) {
                remote.uploadEvent(e);
            }
            int upEvents = outgoing.size();
            local.recordLastSync(clock.instant());

            // 3) download
            int downSpaces = 0;
            for (StoredSpace theirs : remote.listSpacesModifiedSince(since)) {
                StoredSpace ours = local.loadSpace(theirs.id()).orElse(null);
                if (spaceResolver.remoteWins(ours, theirs)) {
                    local.saveSpace(theirs);
                    downSpaces++;
                }
            }
            int downAnchors = 0;
            int downEvents = 0;
            for (Anchor theirs : remote.listAnchorsModifiedSince(since)) {
                Anchor ours = local.loadAnchor(theirs.id()).orElse(null);
                if (anchorResolver.remoteWins(ours, theirs)) {
                    downEvents += appendRemoteHistory(theirs.id(), remote.listEventsForAnchor(theirs.id()));
                    local.saveAnchor(theirs);
                    downAnchors++;
                }
            }

            var report = new SyncReport(since, clock.instant(), replayed, pending.size(), dropped,
                    upSpaces, upAnchors, upEvents, downSpaces, downAnchors, downEvents);
            log.info(() -> "Sync complete: uploaded " + report.uploadedSpaces() + " spaces, "
                    + report.uploadedAnchors() + " anchors, " + report.uploadedEvents() + " events; downloaded "
                    + report.downloadedSpaces() + " spaces, " + report.downloadedAnchors() + " anchors, "
                    + report.downloadedEvents() + " events; "
                    + report.stillPending() + " pending, " + report.dropped().size() + " dropped");
            return report;
        } catch (RemoteStoreException e) {
            throw new CloudSyncFailedException(e);
        }
    }

    // ---------- data management ----------

    /** Wipe the local store, including the retry queue and sync state. */
    public synchronized void clearLocalStorage() {
        local.clearAll();
        pending.clear();
    }

    public long localStorageSize() {
        return local.totalSize();
    }

    public boolean isCloudEnabled() {
        return remote != null;
    }

    public synchronized int pendingOperationCount() {
        return pending.size();
    }

    public synchronized List<PendingOperation> pendingOperations() {
        return List.copyOf(pending);
    }

    /** Operations given up on after {@value #MAX_ATTEMPTS} failed replays. */
    public List<PendingOperation> droppedOperations() {
        return local.loadDroppedOperations();
    }

    // ---------- helpers ----------

    /**
     * Give a record without events a synthetic history and return the current version.
     * A deleted legacy record also gets its DELETED event.
     */
    private int migrateIfNeeded(Anchor previous, List<AnchorEvent> appended) {
        int version = local.currentVersion(previous.id(), previous.spaceId());
        if (version > 0) {
            return version;
        }
        AnchorEvent created = AnchorEvent.created(previous, 1, previous.createdAt());
        local.appendEvent(created);
        appended.add(created);
        version = 1;
        if (previous.isDeleted()) {
            AnchorEvent deleted = AnchorEvent.deleted(previous, 2, previous.deletedAt());
            local.appendEvent(deleted);
            appended.add(deleted);
            version = 2;
        }
        log.info("Migrated anchor " + previous.id() + " to versioned history (" + appended.size() + " synthetic events)");
        return version;
    }

    /**
     * Append remote events that continue the local history of an anchor, in version order.
     * Events already known by id, or at or below the local current version, are skipped.
     *
     * @return number of events appended
     */
    private int appendRemoteHistory(UUID anchorId, List<AnchorEvent> remoteHistory) {
        List<AnchorEvent> known = local.loadEventsForAnchor(anchorId);
        Set<UUID> knownIds = new HashSet<>();
        int latest = 0;
        for (AnchorEvent e : known) {
            knownIds.add(e.id());
            latest = Math.max(latest, e.version());
        }
        List<AnchorEvent> incoming = new ArrayList<>(remoteHistory);
        incoming.sort(Comparator.comparingInt(AnchorEvent::version));
        int appended = 0;
        for (AnchorEvent e : incoming) {
            if (!e.anchorId().equals(anchorId) || knownIds.contains(e.id()) || e.version() <= latest) {
                continue;
            }
            local.appendEvent(e);
            latest = e.version();
            appended++;
        }
        if (appended > 0) {
            int count = appended;
            log.fine(() -> "adopted " + count + " remote events for anchor " + anchorId);
        }
        return appended;
    }

    /** Which event the change from {@code before} to {@code after} produces, or null for none. */
    static EventType classify(Anchor before, Anchor after) {
        if (!before.isDeleted() && after.isDeleted()) return EventType.DELETED;
        if (before.isDeleted() && !after.isDeleted()) return EventType.RESTORED;
        if (!before.transform().equals(after.transform())) return EventType.MOVED;
        if (!before.metadata().equals(after.metadata())) return EventType.UPDATED;
        return null;
    }

    private boolean pushOnSave() {
        return isCloudEnabled() && config.syncsOnSave();
    }

    private void pushAnchor(Anchor anchor, List<AnchorEvent> events) {
        if (!pushOnSave()) {
            return;
        }
        try {
            remote.uploadAnchor(anchor);
            for (AnchorEvent e : events) {
                remote.uploadEvent(e);
            }
        } catch (RemoteStoreException e) {
            throw queueAndFail(OperationKind.SAVE_ANCHOR, anchor.id(), e);
        }
    }

    private CloudSyncFailedException queueAndFail(OperationKind kind, UUID targetId, RemoteStoreException cause) {
        pending.add(PendingOperation.create(kind, targetId, clock.instant()));
        log.log(Level.WARNING, "Remote write failed, queued " + kind + " for " + targetId + ": " + cause.getMessage());
        var failure = new CloudSyncFailedException(cause);
        try {
            local.savePendingOperations(List.copyOf(pending));
        } catch (RuntimeException persistFailure) {
            log.log(Level.SEVERE, "Could not persist the retry queue", persistFailure);
            failure.addSuppressed(persistFailure);
        }
        return failure;
    }

    /** Re-run one queued operation against the current local record. */
    private void replay(PendingOperation op) {
        switch (op.kind()) {
            case SAVE_SPACE -> local.loadSpace(op.targetId()).ifPresent(remote::uploadSpace);
            case DELETE_SPACE -> remote.deleteSpace(op.targetId());
            case SAVE_ANCHOR -> {
                Optional<Anchor> anchor = local.loadAnchor(op.targetId());
                if (anchor.isPresent()) {
                    remote.uploadAnchor(anchor.get());
                    for (AnchorEvent e : local.loadEventsForAnchor(op.targetId())) {
                        remote.uploadEvent(e);
                    }
                }
            }
        }
    }

    private <T> T remoteRead(Supplier<T> read) {
        try {
            return read.get();
        } catch (RemoteStoreException e) {
            throw new CloudSyncFailedException(e);
        }
    }

    private Space decode(StoredSpace stored) {
        byte[] payload = stored.compressed() ? compression.decompress(stored.payload()) : stored.payload();
        return stored.toSpace(payload);
    }
}
