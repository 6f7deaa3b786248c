package io.anchorbase.storage;

import io.anchorbase.core.error.CompressionFailedException;
import io.anchorbase.core.error.DecompressionFailedException;

import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Objects;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * zlib compression for opaque payloads.
 * <p>
 * The compressed form does not record the original size, so decompression grows its
 * output buffer: it starts at four times the input length and doubles up to
 * {@code maxOutputBytes}. Output that would exceed the ceiling fails instead of being
 * truncated.
 * <p>
 * Empty input maps to empty output in both directions.
 */
public final class CompressionCodec {
    public static final int DEFAULT_MAX_OUTPUT_BYTES = 512 * 1024 * 1024;
    private static final int MAX_ARRAY_BYTES = Integer.MAX_VALUE - 8;
    private static final int CHUNK = 8192;

    private final int maxOutputBytes;

    public CompressionCodec() {
        this(DEFAULT_MAX_OUTPUT_BYTES);
    }

    public CompressionCodec(int maxOutputBytes) {
        if (maxOutputBytes <= 0 || maxOutputBytes > MAX_ARRAY_BYTES) {
            throw new IllegalArgumentException("maxOutputBytes out of range: " + maxOutputBytes);
        }
        this.maxOutputBytes = maxOutputBytes;
    }

    public int maxOutputBytes() { return maxOutputBytes; }

    public byte[] compress(byte[] data, CompressionLevel level) {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(level, "level");
        if (level == CompressionLevel.NONE || data.length == 0) {
            return Arrays.copyOf(data, data.length);
        }

        Deflater deflater = new Deflater(Deflater.DEFAULT_COMPRESSION);
        try {
            deflater.setInput(data);
            deflater.finish();
            var out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
            byte[] buf = new byte[CHUNK];
            while (!deflater.finished()) {
                int n = deflater.deflate(buf);
                out.write(buf, 0, n);
            }
            byte[] compressed = out.toByteArray();
            if (compressed.length == 0) {
                throw new CompressionFailedException("encoder produced no output for " + data.length + " bytes");
            }
            return compressed;
        } finally {
            deflater.end();
        }
    }

    public byte[] decompress(byte[] data) {
        Objects.requireNonNull(data, "data");
        if (data.length == 0) {
            return new byte[0];
        }

        Inflater inflater = new Inflater();
        try {
            inflater.setInput(data);
            long initial = Math.max(64L, 4L * data.length);
            byte[] out = new byte[(int) Math.min(initial, maxOutputBytes)];
            int total = 0;

            while (!inflater.finished()) {
                if (total == out.length) {
                    if (out.length >= maxOutputBytes) {
                        throw new DecompressionFailedException(
                                "output exceeds limit of " + maxOutputBytes + " bytes");
                    }
                    out = Arrays.copyOf(out, (int) Math.min((long) out.length * 2, maxOutputBytes));
                }
                int n = inflater.inflate(out, total, out.length - total);
                total += n;
                if (n == 0 && !inflater.finished()) {
                    if (inflater.needsDictionary()) {
                        throw new DecompressionFailedException("stream requires a preset dictionary");
                    }
                    if (inflater.needsInput()) {
                        throw new DecompressionFailedException("truncated stream");
                    }
                    if (total < out.length) {
                        throw new DecompressionFailedException("inflater made no progress");
                    }
                }
            }
            return Arrays.copyOf(out, total);
        } catch (DataFormatException e) {
            throw new DecompressionFailedException("malformed input", e);
        } finally {
            inflater.end();
        }
    }
}
