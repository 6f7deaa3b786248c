package io.anchorbase.server;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReplicaServerConfigTest {

    @Test
    void defaults_when_no_flags() {
        var cfg = ReplicaServerConfig.parse(new String[0]);
        assertEquals(ReplicaServerConfig.DEFAULT_HOST, cfg.host());
        assertEquals(8080, cfg.port());
    }

    @Test
    void long_and_short_flags() {
        assertEquals(9000, ReplicaServerConfig.parse(new String[]{"-p", "9000"}).port());

        var cfg = ReplicaServerConfig.parse(new String[]{"--host", "127.0.0.1", "--port", "9100"});
        assertEquals("127.0.0.1", cfg.host());
        assertEquals(9100, cfg.port());
    }

    @Test
    void bad_flags_are_rejected() {
        assertThrows(IllegalArgumentException.class, () -> ReplicaServerConfig.parse(new String[]{"--port", "abc"}));
        assertThrows(IllegalArgumentException.class, () -> ReplicaServerConfig.parse(new String[]{"--port"}));
        assertThrows(IllegalArgumentException.class, () -> ReplicaServerConfig.parse(new String[]{"--port", "70000"}));
        assertThrows(IllegalArgumentException.class, () -> ReplicaServerConfig.parse(new String[]{"--verbose"}));
    }

    @Test
    void help_is_signalled() {
        assertThrows(ReplicaServerConfig.HelpRequested.class, () -> ReplicaServerConfig.parse(new String[]{"-h"}));
    }
}
