package io.anchorbase.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.util.zip.CRC32;

/**
 * Binary framing shared by record files and event-log entries.
 * <p>
 * Layout:
 * <p>
 *   [HEADER (11 bytes, little-endian)]
 *     - magic   (2B)  = 0xAB5E
 *     - version (1B)  = 1
 *     - length  (4B)  = payload length in bytes
 *     - crc32   (4B)  = CRC32(payload)
 * <p>
 *   [PAYLOAD (length bytes)]
 * <p>
 * A record file holds exactly one frame. An event log is a sequence of frames.
 */
final class RecordCodec {
    static final short MAGIC = (short) 0xAB5E;
    static final byte VERSION = 1;
    static final int HEADER_BYTES = 2 + 1 + 4 + 4;

    private RecordCodec() {
    }

    /** Outcome of reading one frame from a log. */
    enum Status { ENTRY, END, TORN, CORRUPT }

    record Read(Status status, byte[] payload, long nextPosition, String detail) {
        static Read end(long pos) { return new Read(Status.END, null, pos, null); }

        static Read torn(long pos, String detail) { return new Read(Status.TORN, null, pos, detail); }

        static Read corrupt(long pos, String detail) { return new Read(Status.CORRUPT, null, pos, detail); }
    }

    static byte[] frame(byte[] payload) {
        ByteBuffer b = ByteBuffer.allocate(HEADER_BYTES + payload.length).order(ByteOrder.LITTLE_ENDIAN);
        b.putShort(MAGIC).put(VERSION).putInt(payload.length).putInt(crc32(payload));
        b.put(payload);
        return b.array();
    }

    /**
     * Verify a single-frame record and return its payload.
     *
     * @throws IOException when the header or checksum does not match
     */
    static byte[] unframe(byte[] record) throws IOException {
        if (record.length < HEADER_BYTES) {
            throw new IOException("record shorter than header (" + record.length + " bytes)");
        }
        ByteBuffer b = ByteBuffer.wrap(record).order(ByteOrder.LITTLE_ENDIAN);
        short magic = b.getShort();
        byte ver = b.get();
        int len = b.getInt();
        int crc = b.getInt();
        if (magic != MAGIC) throw new IOException("bad magic");
        if (ver != VERSION) throw new IOException("unsupported format version " + ver);
        if (len != record.length - HEADER_BYTES) {
            throw new IOException("length mismatch: header says " + len + ", have " + (record.length - HEADER_BYTES));
        }
        byte[] payload = new byte[len];
        b.get(payload);
        if (crc32(payload) != crc) throw new IOException("checksum mismatch");
        return payload;
    }

    /**
     * Read the frame starting at {@code pos}.
     * <p>
     * A frame that runs past the end of the file, or a bad checksum on the last frame,
     * is a torn tail. A damaged frame followed by more data is corruption.
     */
    static Read readFrame(FileChannel ch, long pos) throws IOException {
        long size = ch.size();
        if (pos >= size) return Read.end(pos);
        if (size - pos < HEADER_BYTES) return Read.torn(pos, "truncated header");

        ByteBuffer hdr = ByteBuffer.allocate(HEADER_BYTES).order(ByteOrder.LITTLE_ENDIAN);
        readFully(ch, hdr, pos);
        hdr.flip();
        short magic = hdr.getShort();
        byte ver = hdr.get();
        int len = hdr.getInt();
        int crc = hdr.getInt();

        if (magic != MAGIC || ver != VERSION) {
            return Read.corrupt(pos, "bad header at offset " + pos);
        }
        long end = pos + HEADER_BYTES + (long) len;
        if (len < 0 || end > size) return Read.torn(pos, "truncated payload at offset " + pos);

        ByteBuffer payload = ByteBuffer.allocate(len);
        readFully(ch, payload, pos + HEADER_BYTES);
        byte[] bytes = payload.array();
        if (crc32(bytes) != crc) {
            return end == size
                    ? Read.torn(pos, "checksum mismatch in last entry")
                    : Read.corrupt(pos, "checksum mismatch at offset " + pos);
        }
        return new Read(Status.ENTRY, bytes, end, null);
    }

    static int crc32(byte[] bytes) {
        CRC32 crc = new CRC32();
        crc.update(bytes, 0, bytes.length);
        return (int) crc.getValue();
    }

    private static void readFully(FileChannel ch, ByteBuffer dst, long pos) throws IOException {
        long p = pos;
        while (dst.hasRemaining()) {
            int n = ch.read(dst, p);
            if (n < 0) throw new IOException("unexpected end of file at offset " + p);
            p += n;
        }
    }
}
