package io.anchorbase.storage;

import io.anchorbase.core.AnchorEvent;
import io.anchorbase.core.error.EventLogCorruptedException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardOpenOption.*;

/**
 * One framed, append-only file per space: {@code <dir>/<spaceId>.log}.
 * <p>
 * append():
 *  - on the first append to a space in this process, scans the file and truncates a
 *    torn tail left by a crash (a damaged entry that is not the tail is corruption),
 *  - writes the framed entry,
 *  - calls force(true) before returning.
 * <p>
 * read():
 *  - decodes entries in order,
 *  - stops silently at a torn tail,
 *  - throws {@link EventLogCorruptedException} on a damaged entry that is followed by data.
 */
public final class FileEventLog implements EventLog {
    private static final Logger log = Logger.getLogger(FileEventLog.class.getName());
    private static final String SUFFIX = ".log";

    private final Path dir;
    private final Set<UUID> verifiedTails = ConcurrentHashMap.newKeySet();

    public FileEventLog(Path dir) {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    @Override
    public synchronized void append(AnchorEvent event) {
        UUID spaceId = event.spaceId();
        byte[] frame = RecordCodec.frame(RecordJson.toBytes(RecordJson.eventNode(event)));
        Path file = fileFor(spaceId);
        try (FileChannel ch = FileChannel.open(file, CREATE, WRITE, READ)) {
            long end = verifiedTails.contains(spaceId) ? ch.size() : repairTail(spaceId, ch);
            ByteBuffer buf = ByteBuffer.wrap(frame);
            long pos = end;
            while (buf.hasRemaining()) {
                pos += ch.write(buf, pos);
            }
            ch.force(true);
            verifiedTails.add(spaceId);
            log.fine(() -> "appended " + event.type() + " v" + event.version() + " for anchor " + event.anchorId());
        } catch (IOException e) {
            throw new UncheckedIOException("event append failed for space " + spaceId, e);
        }
    }

    @Override
    public List<AnchorEvent> read(UUID spaceId) {
        Path file = fileFor(spaceId);
        List<AnchorEvent> events = new ArrayList<>();
        try (FileChannel ch = FileChannel.open(file, READ)) {
            long pos = 0;
            while (true) {
                RecordCodec.Read r = RecordCodec.readFrame(ch, pos);
                switch (r.status()) {
                    case ENTRY -> {
                        events.add(decode(spaceId, r.payload(), pos));
                        pos = r.nextPosition();
                    }
                    case END -> {
                        return events;
                    }
                    case TORN -> {
                        log.fine(() -> "ignoring torn tail in " + file + ": " + r.detail());
                        return events;
                    }
                    case CORRUPT -> throw new EventLogCorruptedException(spaceId, r.detail());
                }
            }
        } catch (NoSuchFileException missing) {
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("event log read failed for space " + spaceId, e);
        }
    }

    @Override
    public List<UUID> spaces() {
        List<UUID> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .sorted()
                    .forEach(name -> {
                        try {
                            ids.add(UUID.fromString(name.substring(0, name.length() - SUFFIX.length())));
                        } catch (IllegalArgumentException notOurs) {
                            log.fine(() -> "skipping foreign file " + name);
                        }
                    });
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return ids;
    }

    @Override
    public long sizeBytes() {
        long total = 0;
        for (UUID id : spaces()) {
            try {
                total += Files.size(fileFor(id));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return total;
    }

    @Override
    public synchronized void clear() {
        for (UUID id : spaces()) {
            try {
                Files.deleteIfExists(fileFor(id));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        verifiedTails.clear();
    }

    Path fileFor(UUID spaceId) {
        return dir.resolve(spaceId + SUFFIX);
    }

    /** Walk the log, cut off a torn tail and return the offset of the valid end. */
    private long repairTail(UUID spaceId, FileChannel ch) throws IOException {
        long pos = 0;
        while (true) {
            RecordCodec.Read r = RecordCodec.readFrame(ch, pos);
            switch (r.status()) {
                case ENTRY -> pos = r.nextPosition();
                case END -> {
                    return pos;
                }
                case TORN -> {
                    long size = ch.size();
                    log.log(Level.WARNING, "Truncating torn tail of event log for space {0}: {1} bytes at offset {2} ({3})",
                            new Object[]{spaceId, size - pos, pos, r.detail()});
                    ch.truncate(pos);
                    ch.force(true);
                    return pos;
                }
                case CORRUPT -> throw new EventLogCorruptedException(spaceId, r.detail());
            }
        }
    }

    private static AnchorEvent decode(UUID spaceId, byte[] payload, long offset) {
        try {
            return RecordJson.readEvent(RecordJson.parse(payload));
        } catch (IllegalArgumentException bad) {
            throw new EventLogCorruptedException(spaceId, "undecodable entry at offset " + offset + ": " + bad.getMessage());
        }
    }
}
