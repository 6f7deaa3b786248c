package io.anchorbase.server;

import io.anchorbase.engine.remote.InMemoryRemoteStore;

import java.util.logging.Logger;

/**
 * Entry point for a standalone replica.
 *
 * Holds records in memory; a restart starts empty and clients re-upload on their next sync.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) {
        var cfg = ReplicaServerConfig.fromArgs(args);

        var store = new InMemoryRemoteStore();
        var web = new ReplicaWebServer(cfg.host(), cfg.port(), store);
        web.start();
        log.info(() -> "Replica listening on http://" + cfg.host() + ":" + cfg.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Stopping replica");
            web.stop();
        }, "replica-shutdown"));
    }
}
