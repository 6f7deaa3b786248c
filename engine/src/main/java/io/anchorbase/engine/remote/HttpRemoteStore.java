package io.anchorbase.engine.remote;

import com.fasterxml.jackson.databind.JsonNode;
import io.anchorbase.core.Anchor;
import io.anchorbase.core.AnchorEvent;
import io.anchorbase.storage.RecordJson;
import io.anchorbase.storage.StoredSpace;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;

/**
 * {@link RemoteStore} that talks to a replica server over HTTP/JSON.
 * <p>
 * Routes (instants are ISO-8601 query values):
 *   PUT    /spaces/{id}                  GET /spaces/{id}       DELETE /spaces/{id}
 *   GET    /spaces?modifiedSince=...
 *   PUT    /anchors/{id}                 GET /anchors/{id}      DELETE /anchors/{id}
 *   GET    /anchors?modifiedSince=...    DELETE /anchors?deletedBefore=...
 *   PUT    /events/{id}                  GET /events?since=...  DELETE /events?olderThan=...
 *   GET    /events?anchorId=...
 * <p>
 * Routes resolve against the base URI, so a prefix such as {@code http://host/replica/} is kept.
 * A base URI without a trailing slash gets one.
 * <p>
 * A 404 on a single-record GET is "absent"; any other non-2xx status, I/O error or
 * interruption becomes {@link RemoteStoreException}.
 */
public final class HttpRemoteStore implements RemoteStore {
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final URI baseUri;
    private final HttpClient client;
    private final Duration timeout;

    public HttpRemoteStore(URI baseUri) {
        this(baseUri, HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(), DEFAULT_TIMEOUT);
    }

    public HttpRemoteStore(URI baseUri, HttpClient client, Duration timeout) {
        this.baseUri = withTrailingSlash(Objects.requireNonNull(baseUri, "baseUri"));
        this.client = Objects.requireNonNull(client, "client");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    // ---------- spaces ----------

    @Override
    public void uploadSpace(StoredSpace space) {
        put("spaces/" + space.id(), RecordJson.toBytes(RecordJson.spaceNode(space)));
    }

    @Override
    public Optional<StoredSpace> downloadSpace(UUID id) {
        return getOne("spaces/" + id, RecordJson::readSpace);
    }

    @Override
    public List<StoredSpace> listSpacesModifiedSince(Instant since) {
        return getList("spaces?modifiedSince=" + encode(since), RecordJson::readSpaces);
    }

    @Override
    public void deleteSpace(UUID id) {
        delete("spaces/" + id);
    }

    // ---------- anchors ----------

    @Override
    public void uploadAnchor(Anchor anchor) {
        put("anchors/" + anchor.id(), RecordJson.toBytes(RecordJson.anchorNode(anchor)));
    }

    @Override
    public Optional<Anchor> downloadAnchor(UUID id) {
        return getOne("anchors/" + id, RecordJson::readAnchor);
    }

    @Override
    public List<Anchor> listAnchorsModifiedSince(Instant since) {
        return getList("anchors?modifiedSince=" + encode(since), RecordJson::readAnchors);
    }

    @Override
    public void deleteAnchor(UUID id) {
        delete("anchors/" + id);
    }

    @Override
    public void purgeDeletedAnchors(Instant before) {
        delete("anchors?deletedBefore=" + encode(before));
    }

    // ---------- events ----------

    @Override
    public void uploadEvent(AnchorEvent event) {
        put("events/" + event.id(), RecordJson.toBytes(RecordJson.eventNode(event)));
    }

    @Override
    public List<AnchorEvent> listEventsSince(Instant since) {
        return getList("events?since=" + encode(since), RecordJson::readEvents);
    }

    @Override
    public List<AnchorEvent> listEventsForAnchor(UUID anchorId) {
        return getList("events?anchorId=" + anchorId, RecordJson::readEvents);
    }

    @Override
    public void deleteEventsOlderThan(Instant cutoff) {
        delete("events?olderThan=" + encode(cutoff));
    }

    /** True when GET /admin/health answers 200. */
    public boolean isHealthy() {
        try {
            return send(request("admin/health").GET().build()).statusCode() == 200;
        } catch (RemoteStoreException e) {
            return false;
        }
    }

    // ---------- plumbing ----------

    private void put(String path, byte[] body) {
        var req = request(path)
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        expectSuccess(req, send(req));
    }

    private void delete(String path) {
        var req = request(path).DELETE().build();
        HttpResponse<byte[]> resp = send(req);
        if (resp.statusCode() != 404) expectSuccess(req, resp);
    }

    private <T> Optional<T> getOne(String path, Function<JsonNode, T> reader) {
        var req = request(path).GET().build();
        HttpResponse<byte[]> resp = send(req);
        if (resp.statusCode() == 404) return Optional.empty();
        expectSuccess(req, resp);
        return Optional.of(decode(req, resp, reader));
    }

    private <T> List<T> getList(String path, Function<JsonNode, List<T>> reader) {
        var req = request(path).GET().build();
        HttpResponse<byte[]> resp = send(req);
        expectSuccess(req, resp);
        return decode(req, resp, reader);
    }

    private HttpRequest.Builder request(String path) {
        return HttpRequest.newBuilder(uriFor(path)).timeout(timeout);
    }

    /** {@code path} is relative (no leading slash) so the base path survives. */
    URI uriFor(String path) {
        return baseUri.resolve(path);
    }

    private static URI withTrailingSlash(URI uri) {
        String raw = uri.toString();
        return raw.endsWith("/") ? uri : URI.create(raw + "/");
    }

    private HttpResponse<byte[]> send(HttpRequest req) {
        try {
            return client.send(req, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new RemoteStoreException(req.method() + " " + req.uri() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteStoreException(req.method() + " " + req.uri() + " interrupted", e);
        }
    }

    private static void expectSuccess(HttpRequest req, HttpResponse<byte[]> resp) {
        int code = resp.statusCode();
        if (code < 200 || code >= 300) {
            throw new RemoteStoreException(
                    "Remote returned HTTP " + code + " for " + req.method() + " " + req.uri()
                            + ": " + new String(resp.body(), StandardCharsets.UTF_8));
        }
    }

    private static <T> T decode(HttpRequest req, HttpResponse<byte[]> resp, Function<JsonNode, T> reader) {
        try {
            return reader.apply(RecordJson.parse(resp.body()));
        } catch (IllegalArgumentException bad) {
            throw new RemoteStoreException("Unreadable response from " + req.uri() + ": " + bad.getMessage(), bad);
        }
    }

    private static String encode(Instant instant) {
        return URLEncoder.encode(instant.toString(), StandardCharsets.UTF_8);
    }
}
