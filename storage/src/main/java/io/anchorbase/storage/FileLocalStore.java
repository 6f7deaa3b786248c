package io.anchorbase.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.anchorbase.core.Anchor;
import io.anchorbase.core.AnchorEvent;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.*;

/**
 * {@link LocalStore} backed by one framed record file per space and anchor.
 * <p>
 * Layout under the base directory:
 *   spaces/&lt;id&gt;.rec          [int32 metaLen][space JSON][payload bytes]
 *   anchors/&lt;id&gt;.rec         anchor JSON
 *   events/&lt;spaceId&gt;.log     see {@link FileEventLog}
 *   pending_operations.rec   JSON array
 *   dropped_operations.rec   JSON array
 *   sync_state.rec           {"lastSyncDate": ...}
 * <p>
 * Atomicity:
 *   - each record is written to "&lt;name&gt;.tmp" and fsynced,
 *   - then moved over the target with ATOMIC_MOVE (plain replace where unsupported).
 */
public final class FileLocalStore implements LocalStore {
    private static final Logger log = Logger.getLogger(FileLocalStore.class.getName());
    private static final String RECORD_SUFFIX = ".rec";
    private static final String TMP_SUFFIX = ".tmp";

    private final Path baseDir;
    private final Path spacesDir;
    private final Path anchorsDir;
    private final Path pendingFile;
    private final Path droppedFile;
    private final Path syncStateFile;
    private final FileEventLog events;

    public FileLocalStore(Path baseDir) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir");
        this.spacesDir = baseDir.resolve("spaces");
        this.anchorsDir = baseDir.resolve("anchors");
        this.pendingFile = baseDir.resolve("pending_operations" + RECORD_SUFFIX);
        this.droppedFile = baseDir.resolve("dropped_operations" + RECORD_SUFFIX);
        this.syncStateFile = baseDir.resolve("sync_state" + RECORD_SUFFIX);
        createDirectories();
        this.events = new FileEventLog(baseDir.resolve("events"));
    }

    public Path baseDir() { return baseDir; }

    // ---------- spaces ----------

    @Override
    public void saveSpace(StoredSpace space) {
        byte[] meta = RecordJson.toBytes(RecordJson.spaceMetaNode(space));
        byte[] payload = space.payload();
        ByteBuffer b = ByteBuffer.allocate(4 + meta.length + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        b.putInt(meta.length).put(meta).put(payload);
        writeRecord(recordPath(spacesDir, space.id()), b.array());
        log.fine(() -> "saved space " + space.id() + " (" + payload.length + " payload bytes)");
    }

    @Override
    public Optional<StoredSpace> loadSpace(UUID id) {
        return readRecord(recordPath(spacesDir, id)).map(bytes -> decodeSpace(id, bytes));
    }

    @Override
    public List<StoredSpace> loadAllSpaces() {
        return readAll(spacesDir, this::loadSpace);
    }

    @Override
    public List<StoredSpace> loadSpacesModifiedSince(Instant since) {
        return loadAllSpaces().stream().filter(s -> s.updatedAt().isAfter(since)).toList();
    }

    @Override
    public void deleteSpace(UUID id) {
        for (Anchor a : loadAnchors(id)) {
            deleteAnchorRecord(a.id());
        }
        deleteFile(recordPath(spacesDir, id));
        log.fine(() -> "deleted space " + id);
    }

    // ---------- anchors ----------

    @Override
    public void saveAnchor(Anchor anchor) {
        writeRecord(recordPath(anchorsDir, anchor.id()), RecordJson.toBytes(RecordJson.anchorNode(anchor)));
    }

    @Override
    public Optional<Anchor> loadAnchor(UUID id) {
        Path p = recordPath(anchorsDir, id);
        return readRecord(p).map(bytes -> decodeJson(p, bytes, RecordJson::readAnchor));
    }

    @Override
    public List<Anchor> loadAnchors(UUID spaceId) {
        return loadAllAnchors().stream().filter(a -> a.spaceId().equals(spaceId)).toList();
    }

    @Override
    public List<Anchor> loadAllAnchors() {
        return readAll(anchorsDir, this::loadAnchor);
    }

    @Override
    public List<Anchor> loadAnchorsModifiedSince(Instant since) {
        return loadAllAnchors().stream().filter(a -> a.updatedAt().isAfter(since)).toList();
    }

    @Override
    public void deleteAnchorRecord(UUID id) {
        deleteFile(recordPath(anchorsDir, id));
    }

    @Override
    public int purgeDeletedAnchors(Instant before) {
        int purged = 0;
        for (Anchor a : loadAllAnchors()) {
            if (a.deletedAt() != null && a.deletedAt().isBefore(before)) {
                deleteAnchorRecord(a.id());
                purged++;
            }
        }
        return purged;
    }

    // ---------- events ----------

    @Override
    public void appendEvent(AnchorEvent event) {
        events.append(event);
    }

    @Override
    public List<AnchorEvent> loadEvents(UUID spaceId) {
        return events.read(spaceId);
    }

    @Override
    public List<AnchorEvent> loadEventsForAnchor(UUID anchorId) {
        List<AnchorEvent> out = new ArrayList<>();
        for (UUID spaceId : events.spaces()) {
            for (AnchorEvent e : events.read(spaceId)) {
                if (e.anchorId().equals(anchorId)) out.add(e);
            }
        }
        out.sort(Comparator.comparingInt(AnchorEvent::version));
        return out;
    }

    @Override
    public List<AnchorEvent> loadEventsSince(Instant since) {
        List<AnchorEvent> out = new ArrayList<>();
        for (UUID spaceId : events.spaces()) {
            for (AnchorEvent e : events.read(spaceId)) {
                if (e.timestamp().isAfter(since)) out.add(e);
            }
        }
        return out;
    }

    @Override
    public int currentVersion(UUID anchorId, UUID spaceId) {
        int max = 0;
        for (AnchorEvent e : events.read(spaceId)) {
            if (e.anchorId().equals(anchorId)) max = Math.max(max, e.version());
        }
        return max;
    }

    // ---------- retry queue ----------

    @Override
    public void savePendingOperations(List<PendingOperation> operations) {
        writeRecord(pendingFile, RecordJson.toBytes(RecordJson.operationsNode(operations)));
    }

    @Override
    public List<PendingOperation> loadPendingOperations() {
        return readRecord(pendingFile)
                .map(bytes -> decodeJson(pendingFile, bytes, RecordJson::readOperations))
                .orElse(List.of());
    }

    @Override
    public void saveDroppedOperations(List<PendingOperation> operations) {
        writeRecord(droppedFile, RecordJson.toBytes(RecordJson.operationsNode(operations)));
    }

    @Override
    public List<PendingOperation> loadDroppedOperations() {
        return readRecord(droppedFile)
                .map(bytes -> decodeJson(droppedFile, bytes, RecordJson::readOperations))
                .orElse(List.of());
    }

    // ---------- sync state ----------

    @Override
    public Optional<Instant> lastSyncDate() {
        return readRecord(syncStateFile).map(bytes -> decodeJson(syncStateFile, bytes, node -> {
            JsonNode v = node.get("lastSyncDate");
            if (v == null || !v.isTextual()) throw new IllegalArgumentException("missing field: lastSyncDate");
            return Instant.parse(v.textValue());
        }));
    }

    @Override
    public void recordLastSync(Instant at) {
        ObjectNode n = RecordJson.mapper().createObjectNode();
        n.put("lastSyncDate", at.toString());
        writeRecord(syncStateFile, RecordJson.toBytes(n));
    }

    // ---------- housekeeping ----------

    @Override
    public long totalSize() {
        try (Stream<Path> files = Files.walk(baseDir)) {
            return files.filter(Files::isRegularFile).mapToLong(p -> {
                try {
                    return Files.size(p);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }).sum();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public void clearAll() {
        events.clear();
        try (Stream<Path> files = Files.walk(baseDir)) {
            List<Path> all = files.sorted(Comparator.reverseOrder()).toList();
            for (Path p : all) {
                if (!p.equals(baseDir)) Files.deleteIfExists(p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to clear " + baseDir, e);
        }
        createDirectories();
        Path eventsDir = baseDir.resolve("events");
        try {
            Files.createDirectories(eventsDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        log.info(() -> "cleared local storage at " + baseDir);
    }

    // ---------- record files ----------

    private void writeRecord(Path target, byte[] payload) {
        byte[] framed = RecordCodec.frame(payload);
        Path tmp = target.resolveSibling(target.getFileName() + TMP_SUFFIX);
        try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(framed);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to write " + tmp, e);
        }
        try {
            try {
                Files.move(tmp, target, ATOMIC_MOVE, REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("failed to replace " + target, e);
        }
    }

    private static Optional<byte[]> readRecord(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException missing) {
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read " + file, e);
        }
        try {
            return Optional.of(RecordCodec.unframe(bytes));
        } catch (IOException e) {
            throw new UncheckedIOException("corrupt record " + file, e);
        }
    }

    private static <T> T decodeJson(Path file, byte[] payload, Function<JsonNode, T> reader) {
        try {
            return reader.apply(RecordJson.parse(payload));
        } catch (IllegalArgumentException | DateTimeException bad) {
            throw new UncheckedIOException("corrupt record " + file, new IOException(bad.getMessage(), bad));
        }
    }

    private static StoredSpace decodeSpace(UUID id, byte[] bytes) {
        Path label = Path.of("spaces", id + RECORD_SUFFIX);
        ByteBuffer b = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        if (b.remaining() < 4) {
            throw new UncheckedIOException("corrupt record " + label, new IOException("missing metadata length"));
        }
        int metaLen = b.getInt();
        if (metaLen < 0 || metaLen > b.remaining()) {
            throw new UncheckedIOException("corrupt record " + label, new IOException("bad metadata length " + metaLen));
        }
        byte[] meta = new byte[metaLen];
        b.get(meta);
        byte[] payload = new byte[b.remaining()];
        b.get(payload);
        return decodeJson(label, meta, node -> RecordJson.readSpace(node, payload));
    }

    private <T> List<T> readAll(Path dir, Function<UUID, Optional<T>> loader) {
        List<T> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            List<String> names = files.map(p -> p.getFileName().toString())
                    .filter(n -> n.endsWith(RECORD_SUFFIX))
                    .sorted()
                    .toList();
            for (String name : names) {
                UUID id;
                try {
                    id = UUID.fromString(name.substring(0, name.length() - RECORD_SUFFIX.length()));
                } catch (IllegalArgumentException notOurs) {
                    log.fine(() -> "skipping foreign file " + dir.resolve(name));
                    continue;
                }
                loader.apply(id).ifPresent(out::add);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out;
    }

    private static Path recordPath(Path dir, UUID id) {
        return dir.resolve(id + RECORD_SUFFIX);
    }

    private static void deleteFile(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to delete " + p, e);
        }
    }

    private void createDirectories() {
        try {
            Files.createDirectories(spacesDir);
            Files.createDirectories(anchorsDir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
