package io.anchorbase.storage;

import io.anchorbase.core.error.DecompressionFailedException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CompressionCodecTest {

    private final CompressionCodec codec = new CompressionCodec();

    private void assertRoundTrip(byte[] original) {
        byte[] packed = codec.compress(original, CompressionLevel.BALANCED);
        assertArrayEquals(original, codec.decompress(packed));
    }

    @Test
    void empty_input_stays_empty() {
        assertEquals(0, codec.compress(new byte[0], CompressionLevel.BALANCED).length);
        assertEquals(0, codec.decompress(new byte[0]).length);
    }

    @Test
    void single_byte_round_trips() {
        assertRoundTrip(new byte[]{42});
    }

    @Test
    void repeating_bytes_shrink_and_round_trip() {
        byte[] data = new byte[10_000];
        Arrays.fill(data, (byte) 7);
        byte[] packed = codec.compress(data, CompressionLevel.BALANCED);
        assertTrue(packed.length < data.length / 10, "got " + packed.length);
        assertArrayEquals(data, codec.decompress(packed));
    }

    @Test
    void random_bytes_round_trip_past_the_initial_buffer() {
        // random data does not compress, so 4x the input is always enough here;
        // the repeating case above exercises buffer growth.
        byte[] data = new byte[100_000];
        new Random(1234).nextBytes(data);
        assertRoundTrip(data);
    }

    @Test
    void none_level_is_identity() {
        byte[] data = {1, 2, 3};
        assertArrayEquals(data, codec.compress(data, CompressionLevel.NONE));
    }

    @Test
    void output_above_ceiling_fails_instead_of_truncating() {
        byte[] data = new byte[1_000_000];
        byte[] packed = codec.compress(data, CompressionLevel.BALANCED);

        var small = new CompressionCodec(100_000);
        var ex = assertThrows(DecompressionFailedException.class, () -> small.decompress(packed));
        assertTrue(ex.getMessage().contains("100000"));
    }

    @Test
    void malformed_and_truncated_streams_fail() {
        assertThrows(DecompressionFailedException.class,
                () -> codec.decompress(new byte[]{1, 2, 3, 4, 5, 6, 7, 8}));

        byte[] packed = codec.compress("hello hello hello hello".getBytes(), CompressionLevel.BALANCED);
        byte[] cut = Arrays.copyOf(packed, packed.length / 2);
        assertThrows(DecompressionFailedException.class, () -> codec.decompress(cut));
    }

    @Test
    void rejects_nonsensical_ceiling() {
        assertThrows(IllegalArgumentException.class, () -> new CompressionCodec(0));
    }
}
