package io.anchorbase.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.anchorbase.core.Anchor;
import io.anchorbase.core.AnchorEvent;
import io.anchorbase.core.EventType;
import io.anchorbase.core.MetadataValue;
import io.anchorbase.core.Transform;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * JSON mapping for every persisted or transmitted record, built on the Jackson tree model.
 * <p>
 * Conventions:
 *  - UUIDs and instants are strings (instants in ISO-8601, as {@link Instant#toString()}).
 *  - Transforms are arrays of 16 numbers.
 *  - Metadata maps onto native JSON types: integral numbers decode as Int, fractional as Real.
 *  - Absent optional fields are omitted, never written as null.
 * <p>
 * Fields are written in a fixed order, so encoding a decoded record yields the same bytes.
 * Malformed input fails with {@link IllegalArgumentException}.
 */
public final class RecordJson {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private RecordJson() {
    }

    public static ObjectMapper mapper() { return MAPPER; }

    // ---------- bytes ----------

    public static byte[] toBytes(JsonNode node) {
        try {
            return MAPPER.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("JSON encoding failed", e);
        }
    }

    public static JsonNode parse(byte[] bytes) {
        try {
            JsonNode node = MAPPER.readTree(bytes);
            if (node == null || node.isMissingNode()) {
                throw new IllegalArgumentException("empty JSON document");
            }
            return node;
        } catch (IOException e) {
            throw new IllegalArgumentException("invalid JSON: " + e.getMessage(), e);
        }
    }

    // ---------- anchors ----------

    public static ObjectNode anchorNode(Anchor a) {
        ObjectNode n = NODES.objectNode();
        n.put("id", a.id().toString());
        n.put("spaceId", a.spaceId().toString());
        n.set("transform", transformNode(a.transform()));
        n.set("metadata", metadataNode(a.metadata()));
        n.put("createdAt", a.createdAt().toString());
        n.put("updatedAt", a.updatedAt().toString());
        if (a.deletedAt() != null) n.put("deletedAt", a.deletedAt().toString());
        return n;
    }

    public static Anchor readAnchor(JsonNode n) {
        return new Anchor(
                uuid(n, "id"),
                uuid(n, "spaceId"),
                readTransform(required(n, "transform")),
                readMetadata(required(n, "metadata")),
                instant(n, "createdAt"),
                instant(n, "updatedAt"),
                optionalInstant(n, "deletedAt"));
    }

    public static ArrayNode anchorsNode(List<Anchor> anchors) {
        ArrayNode arr = NODES.arrayNode();
        anchors.forEach(a -> arr.add(anchorNode(a)));
        return arr;
    }

    public static List<Anchor> readAnchors(JsonNode arr) {
        List<Anchor> out = new ArrayList<>();
        for (JsonNode n : array(arr)) out.add(readAnchor(n));
        return out;
    }

    // ---------- events ----------

    public static ObjectNode eventNode(AnchorEvent e) {
        ObjectNode n = NODES.objectNode();
        n.put("id", e.id().toString());
        n.put("anchorId", e.anchorId().toString());
        n.put("spaceId", e.spaceId().toString());
        n.put("type", e.type().name());
        n.put("timestamp", e.timestamp().toString());
        n.put("version", e.version());
        if (e.transform() != null) n.set("transform", transformNode(e.transform()));
        if (e.metadata() != null) n.set("metadata", metadataNode(e.metadata()));
        if (e.actorId() != null) n.put("actorId", e.actorId());
        return n;
    }

    public static AnchorEvent readEvent(JsonNode n) {
        EventType type;
        try {
            type = EventType.valueOf(text(n, "type"));
        } catch (IllegalArgumentException bad) {
            throw new IllegalArgumentException("unknown event type: " + n.get("type"), bad);
        }
        JsonNode t = n.get("transform");
        JsonNode m = n.get("metadata");
        JsonNode actor = n.get("actorId");
        return new AnchorEvent(
                uuid(n, "id"),
                uuid(n, "anchorId"),
                uuid(n, "spaceId"),
                type,
                instant(n, "timestamp"),
                required(n, "version").asInt(),
                t == null || t.isNull() ? null : readTransform(t),
                m == null || m.isNull() ? null : readMetadata(m),
                actor == null || actor.isNull() ? null : actor.asText());
    }

    public static ArrayNode eventsNode(List<AnchorEvent> events) {
        ArrayNode arr = NODES.arrayNode();
        events.forEach(e -> arr.add(eventNode(e)));
        return arr;
    }

    public static List<AnchorEvent> readEvents(JsonNode arr) {
        List<AnchorEvent> out = new ArrayList<>();
        for (JsonNode n : array(arr)) out.add(readEvent(n));
        return out;
    }

    // ---------- spaces ----------

    /** Space fields without the payload; used as the header of a space record file. */
    public static ObjectNode spaceMetaNode(StoredSpace s) {
        ObjectNode n = NODES.objectNode();
        n.put("id", s.id().toString());
        s.name().ifPresent(name -> n.put("name", name));
        n.put("compressed", s.compressed());
        n.put("createdAt", s.createdAt().toString());
        n.put("updatedAt", s.updatedAt().toString());
        return n;
    }

    /** Space fields plus the payload as base64; the wire form. */
    public static ObjectNode spaceNode(StoredSpace s) {
        ObjectNode n = spaceMetaNode(s);
        n.put("payloadBase64", Base64.getEncoder().encodeToString(s.payload()));
        return n;
    }

    public static StoredSpace readSpace(JsonNode meta, byte[] payload) {
        JsonNode name = meta.get("name");
        return new StoredSpace(
                uuid(meta, "id"),
                name == null || name.isNull() ? null : name.asText(),
                payload,
                required(meta, "compressed").asBoolean(),
                instant(meta, "createdAt"),
                instant(meta, "updatedAt"));
    }

    public static StoredSpace readSpace(JsonNode n) {
        byte[] payload;
        try {
            payload = Base64.getDecoder().decode(text(n, "payloadBase64"));
        } catch (IllegalArgumentException bad) {
            throw new IllegalArgumentException("payloadBase64 is not valid base64", bad);
        }
        return readSpace(n, payload);
    }

    public static ArrayNode spacesNode(List<StoredSpace> spaces) {
        ArrayNode arr = NODES.arrayNode();
        spaces.forEach(s -> arr.add(spaceNode(s)));
        return arr;
    }

    public static List<StoredSpace> readSpaces(JsonNode arr) {
        List<StoredSpace> out = new ArrayList<>();
        for (JsonNode n : array(arr)) out.add(readSpace(n));
        return out;
    }

    // ---------- pending operations ----------

    public static ArrayNode operationsNode(List<PendingOperation> ops) {
        ArrayNode arr = NODES.arrayNode();
        for (PendingOperation op : ops) {
            ObjectNode n = arr.addObject();
            n.put("id", op.id().toString());
            n.put("kind", op.kind().name());
            n.put("targetId", op.targetId().toString());
            n.put("retryCount", op.retryCount());
            n.put("createdAt", op.createdAt().toString());
        }
        return arr;
    }

    public static List<PendingOperation> readOperations(JsonNode arr) {
        List<PendingOperation> out = new ArrayList<>();
        for (JsonNode n : array(arr)) {
            OperationKind kind;
            try {
                kind = OperationKind.valueOf(text(n, "kind"));
            } catch (IllegalArgumentException bad) {
                throw new IllegalArgumentException("unknown operation kind: " + n.get("kind"), bad);
            }
            out.add(new PendingOperation(
                    uuid(n, "id"),
                    kind,
                    uuid(n, "targetId"),
                    required(n, "retryCount").asInt(),
                    instant(n, "createdAt")));
        }
        return out;
    }

    // ---------- transforms & metadata ----------

    public static ArrayNode transformNode(Transform t) {
        ArrayNode arr = NODES.arrayNode(Transform.SIZE);
        for (double d : t.elements()) arr.add(d);
        return arr;
    }

    public static Transform readTransform(JsonNode arr) {
        if (!arr.isArray()) throw new IllegalArgumentException("transform must be an array");
        double[] values = new double[arr.size()];
        for (int i = 0; i < values.length; i++) {
            JsonNode v = arr.get(i);
            if (!v.isNumber()) throw new IllegalArgumentException("transform element " + i + " is not a number");
            values[i] = v.asDouble();
        }
        return Transform.of(values);
    }

    public static ObjectNode metadataNode(Map<String, MetadataValue> metadata) {
        ObjectNode n = NODES.objectNode();
        metadata.forEach((k, v) -> n.set(k, valueNode(v)));
        return n;
    }

    public static Map<String, MetadataValue> readMetadata(JsonNode n) {
        if (!n.isObject()) throw new IllegalArgumentException("metadata must be an object");
        var out = new LinkedHashMap<String, MetadataValue>();
        Iterator<Map.Entry<String, JsonNode>> fields = n.fields();
        while (fields.hasNext()) {
            var f = fields.next();
            out.put(f.getKey(), readValue(f.getValue()));
        }
        return out;
    }

    public static JsonNode valueNode(MetadataValue v) {
        if (v instanceof MetadataValue.Text t) return NODES.textNode(t.value());
        if (v instanceof MetadataValue.Int i) return NODES.numberNode(i.value());
        if (v instanceof MetadataValue.Real r) return NODES.numberNode(r.value());
        if (v instanceof MetadataValue.Bool b) return NODES.booleanNode(b.value());
        if (v instanceof MetadataValue.ListOf l) {
            ArrayNode arr = NODES.arrayNode();
            l.values().forEach(item -> arr.add(valueNode(item)));
            return arr;
        }
        if (v instanceof MetadataValue.MapOf m) return metadataNode(m.values());
        return NODES.nullNode();
    }

    public static MetadataValue readValue(JsonNode n) {
        if (n == null || n.isNull()) return MetadataValue.nullValue();
        if (n.isTextual()) return MetadataValue.of(n.textValue());
        if (n.isBoolean()) return MetadataValue.of(n.booleanValue());
        if (n.isIntegralNumber()) {
            if (!n.canConvertToLong()) throw new IllegalArgumentException("integer out of 64-bit range: " + n);
            return MetadataValue.of(n.longValue());
        }
        if (n.isNumber()) return MetadataValue.of(n.doubleValue());
        if (n.isArray()) {
            List<MetadataValue> items = new ArrayList<>(n.size());
            for (JsonNode item : n) items.add(readValue(item));
            return MetadataValue.of(items);
        }
        if (n.isObject()) return MetadataValue.of(readMetadata(n));
        throw new IllegalArgumentException("unsupported metadata value: " + n.getNodeType());
    }

    // ---------- field helpers ----------

    private static JsonNode required(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull()) throw new IllegalArgumentException("missing field: " + field);
        return v;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = required(n, field);
        if (!v.isTextual()) throw new IllegalArgumentException("field " + field + " must be a string");
        return v.textValue();
    }

    private static UUID uuid(JsonNode n, String field) {
        String raw = text(n, field);
        try {
            return UUID.fromString(raw);
        } catch (IllegalArgumentException bad) {
            throw new IllegalArgumentException("field " + field + " is not a UUID", bad);
        }
    }

    private static Instant instant(JsonNode n, String field) {
        String raw = text(n, field);
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException bad) {
            throw new IllegalArgumentException("field " + field + " is not an ISO-8601 instant", bad);
        }
    }

    private static Instant optionalInstant(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return v == null || v.isNull() ? null : instant(n, field);
    }

    private static Iterable<JsonNode> array(JsonNode n) {
        if (n == null || !n.isArray()) throw new IllegalArgumentException("expected a JSON array");
        return n;
    }
}
