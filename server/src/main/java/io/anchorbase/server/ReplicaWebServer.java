package io.anchorbase.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.anchorbase.core.Anchor;
import io.anchorbase.core.AnchorEvent;
import io.anchorbase.engine.remote.RemoteStore;
import io.anchorbase.storage.RecordJson;
import io.anchorbase.storage.StoredSpace;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Deque;
import java.util.Map;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Thin HTTP adapter that exposes a {@link RemoteStore} as a replica for
 * {@link io.anchorbase.engine.remote.HttpRemoteStore} clients.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into records.
 *  - Convert store results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - PUT | GET | DELETE  /spaces/{id}
 *   - GET                 /spaces?modifiedSince={instant}
 *   - PUT | GET | DELETE  /anchors/{id}
 *   - GET                 /anchors?modifiedSince={instant}
 *   - DELETE              /anchors?deletedBefore={instant}
 *   - PUT                 /events/{id}
 *   - GET                 /events?since={instant}
 *   - GET                 /events?anchorId={id}
 *   - DELETE              /events?olderThan={instant}
 *   - GET                 /admin/health
 *
 * A record uploaded with PUT must carry the id named in the path.
 */
public final class ReplicaWebServer {
    private static final Logger log = Logger.getLogger(ReplicaWebServer.class.getName());

    /** Space payloads travel as base64, so leave room for large scans. */
    public static final int DEFAULT_MAX_BODY_BYTES = 64 * 1024 * 1024;

    private final Undertow server;
    private final ObjectMapper json = RecordJson.mapper();
    private final RemoteStore store;
    private final int maxBodyBytes;

    public ReplicaWebServer(String host, int port, RemoteStore store) {
        this(host, port, store, DEFAULT_MAX_BODY_BYTES);
    }

    public ReplicaWebServer(String host, int port, RemoteStore store, int maxBodyBytes) {
        if (maxBodyBytes <= 0) {
            throw new IllegalArgumentException("maxBodyBytes must be > 0");
        }
        this.store = store;
        this.maxBodyBytes = maxBodyBytes;

        this.server = Undertow.builder()
                .addHttpListener(port, host)
                .setHandler(exchange -> {
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                    if ("PUT".equals(exchange.getRequestMethod().toString())) {
                        exchange.getRequestReceiver().receiveFullBytes(
                                this::dispatch,
                                (ex, ioEx) -> {
                                    send(ex, 400, Map.of("error", "invalid request body"));
                                    RequestLogger.logRequest("PUT", ex.getRequestPath(), 400, 0, -1, ioEx);
                                });
                    } else {
                        dispatch(exchange, new byte[0]);
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void dispatch(HttpServerExchange ex, byte[] body) {
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        long start = System.nanoTime();
        int status;
        long storageMs = -1L;
        Throwable error = null;

        try {
            if (body.length > maxBodyBytes) {
                status = 413;
                send(ex, status, Map.of("error", "request body too large"));
            } else {
                Route route = Route.parse(path);
                if (route == null) {
                    status = 404;
                    send(ex, status, Map.of("error", "not found"));
                } else {
                    long sStart = System.nanoTime();
                    Reply reply = route(route, method, ex, body);
                    storageMs = (System.nanoTime() - sStart) / 1_000_000L;
                    status = reply.status();
                    send(ex, status, reply.body());
                }
            }
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(method, path, status, totalMs, storageMs, error);
    }

    private Reply route(Route route, String method, HttpServerExchange ex, byte[] body) {
        switch (route.collection()) {
            case "admin" -> {
                if (!"health".equals(route.id()) || !"GET".equals(method)) return Reply.NOT_FOUND;
                return Reply.ok(Map.of("status", "ok"));
            }
            case "spaces" -> {
                return route.id() == null ? spaces(method, ex) : space(method, uuid(route.id()), body);
            }
            case "anchors" -> {
                return route.id() == null ? anchors(method, ex) : anchor(method, uuid(route.id()), body);
            }
            case "events" -> {
                return route.id() == null ? events(method, ex) : event(method, uuid(route.id()), body);
            }
            default -> {
                return Reply.NOT_FOUND;
            }
        }
    }

    // ---------- handlers ----------

    private Reply space(String method, UUID id, byte[] body) {
        switch (method) {
            case "PUT" -> {
                StoredSpace space = RecordJson.readSpace(RecordJson.parse(body));
                requireSameId(id, space.id());
                store.uploadSpace(space);
                return Reply.ok(Map.of("ok", true));
            }
            case "GET" -> {
                return store.downloadSpace(id)
                        .map(s -> Reply.ok(RecordJson.spaceNode(s)))
                        .orElse(Reply.NOT_FOUND);
            }
            case "DELETE" -> {
                if (store.downloadSpace(id).isEmpty()) return Reply.NOT_FOUND;
                store.deleteSpace(id);
                return Reply.ok(Map.of("ok", true));
            }
            default -> {
                return Reply.METHOD_NOT_ALLOWED;
            }
        }
    }

    private Reply spaces(String method, HttpServerExchange ex) {
        if (!"GET".equals(method)) return Reply.METHOD_NOT_ALLOWED;
        Instant since = instantParam(ex, "modifiedSince");
        return Reply.ok(RecordJson.spacesNode(store.listSpacesModifiedSince(since)));
    }

    private Reply anchor(String method, UUID id, byte[] body) {
        switch (method) {
            case "PUT" -> {
                Anchor anchor = RecordJson.readAnchor(RecordJson.parse(body));
                requireSameId(id, anchor.id());
                store.uploadAnchor(anchor);
                return Reply.ok(Map.of("ok", true));
            }
            case "GET" -> {
                return store.downloadAnchor(id)
                        .map(a -> Reply.ok(RecordJson.anchorNode(a)))
                        .orElse(Reply.NOT_FOUND);
            }
            case "DELETE" -> {
                if (store.downloadAnchor(id).isEmpty()) return Reply.NOT_FOUND;
                store.deleteAnchor(id);
                return Reply.ok(Map.of("ok", true));
            }
            default -> {
                return Reply.METHOD_NOT_ALLOWED;
            }
        }
    }

    private Reply anchors(String method, HttpServerExchange ex) {
        switch (method) {
            case "GET" -> {
                Instant since = instantParam(ex, "modifiedSince");
                return Reply.ok(RecordJson.anchorsNode(store.listAnchorsModifiedSince(since)));
            }
            case "DELETE" -> {
                store.purgeDeletedAnchors(instantParam(ex, "deletedBefore"));
                return Reply.ok(Map.of("ok", true));
            }
            default -> {
                return Reply.METHOD_NOT_ALLOWED;
            }
        }
    }

    private Reply event(String method, UUID id, byte[] body) {
        if (!"PUT".equals(method)) return Reply.METHOD_NOT_ALLOWED;
        AnchorEvent event = RecordJson.readEvent(RecordJson.parse(body));
        requireSameId(id, event.id());
        store.uploadEvent(event);
        return Reply.ok(Map.of("ok", true));
    }

    private Reply events(String method, HttpServerExchange ex) {
        switch (method) {
            case "GET" -> {
                String anchorId = firstOrNull(ex.getQueryParameters().get("anchorId"));
                if (anchorId != null) {
                    return Reply.ok(RecordJson.eventsNode(store.listEventsForAnchor(uuid(anchorId))));
                }
                return Reply.ok(RecordJson.eventsNode(store.listEventsSince(instantParam(ex, "since"))));
            }
            case "DELETE" -> {
                store.deleteEventsOlderThan(instantParam(ex, "olderThan"));
                return Reply.ok(Map.of("ok", true));
            }
            default -> {
                return Reply.METHOD_NOT_ALLOWED;
            }
        }
    }

    // ---------- helpers ----------

    /** "/anchors/{id}" split into collection and optional id; null for anything deeper. */
    record Route(String collection, String id) {
        static Route parse(String path) {
            String trimmed = path.startsWith("/") ? path.substring(1) : path;
            if (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
            if (trimmed.isEmpty()) return null;
            String[] parts = trimmed.split("/", -1);
            if (parts.length > 2 || parts[0].isEmpty()) return null;
            return new Route(parts[0], parts.length == 2 ? parts[1] : null);
        }
    }

    private record Reply(int status, Object body) {
        static final Reply NOT_FOUND = new Reply(404, Map.of("error", "not found"));
        static final Reply METHOD_NOT_ALLOWED = new Reply(405, Map.of("error", "method not allowed"));

        static Reply ok(Object body) {
            return new Reply(200, body);
        }
    }

    private static UUID uuid(String raw) {
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException bad) {
            throw new IllegalArgumentException("not a valid id: " + raw, bad);
        }
    }

    private static void requireSameId(UUID pathId, UUID bodyId) {
        if (!pathId.equals(bodyId)) {
            throw new IllegalArgumentException("body id " + bodyId + " does not match path id " + pathId);
        }
    }

    private static Instant instantParam(HttpServerExchange ex, String name) {
        String raw = firstOrNull(ex.getQueryParameters().get(name));
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("missing query param: " + name);
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException bad) {
            throw new IllegalArgumentException(name + " must be an ISO-8601 instant", bad);
        }
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            log.log(Level.WARNING, "Could not serialize response for " + ex.getRequestPath(), e);
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
