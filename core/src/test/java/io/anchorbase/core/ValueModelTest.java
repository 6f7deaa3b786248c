package io.anchorbase.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static io.anchorbase.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ValueModelTest {

    @Test
    void transform_requires_sixteen_elements() {
        var ex = assertThrows(IllegalArgumentException.class, () -> Transform.of(1, 2, 3));
        assertTrue(ex.getMessage().contains("got 3"));
        assertThrows(IllegalArgumentException.class, () -> Transform.of(List.of(1.0)));
        assertEquals(Transform.identity(), Transform.of(Transform.identity().elements()));
    }

    @Test
    void transform_rejects_non_finite_elements() {
        double[] raw = Transform.identity().elements();
        raw[12] = Double.NaN;
        var ex = assertThrows(IllegalArgumentException.class, () -> Transform.of(raw));
        assertTrue(ex.getMessage().contains("element 12"));
        assertThrows(IllegalArgumentException.class,
                () -> Transform.translation(Double.POSITIVE_INFINITY, 0, 0));
        assertThrows(IllegalArgumentException.class,
                () -> Transform.of(List.of(1, 0, 0, 0, 0, 1, 0, 0, 0, 0, 1, 0, 0, 0, Double.NEGATIVE_INFINITY, 1)));
    }

    @Test
    void real_metadata_must_be_finite() {
        assertThrows(IllegalArgumentException.class, () -> MetadataValue.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> new MetadataValue.Real(Double.POSITIVE_INFINITY));
        assertEquals(Double.MAX_VALUE, MetadataValue.of(Double.MAX_VALUE).asDouble().orElseThrow());
    }

    @Test
    void transform_is_not_affected_by_caller_arrays() {
        double[] raw = Transform.identity().elements();
        Transform t = Transform.of(raw);
        raw[0] = 42;
        t.elements()[1] = 42;
        assertEquals(1.0, t.get(0));
        assertEquals(0.0, t.get(1));
    }

    @Test
    void translation_lands_in_last_column() {
        Position p = Transform.translation(1.5, -2, 3).position();
        assertEquals(new Position(1.5, -2, 3), p);
        assertEquals(5.0, new Position(0, 0, 0).distanceTo(new Position(3, 4, 0)), 1e-12);
    }

    @Test
    void metadata_accessors_return_empty_on_type_mismatch() {
        MetadataValue text = MetadataValue.of("hi");
        assertEquals("hi", text.asString().orElseThrow());
        assertTrue(text.asLong().isEmpty());
        assertTrue(text.asBoolean().isEmpty());
        assertFalse(text.isNull());

        assertEquals(7L, MetadataValue.of(7).asLong().orElseThrow());
        assertTrue(MetadataValue.of(7).asDouble().isEmpty());
        assertTrue(MetadataValue.nullValue().isNull());
        assertTrue(MetadataValue.nullValue().asMap().isEmpty());

        var nested = MetadataValue.of(Map.of("k", MetadataValue.of(List.of(MetadataValue.of(true)))));
        assertEquals(true, nested.asMap().orElseThrow().get("k").asList().orElseThrow().get(0).asBoolean().orElseThrow());
    }

    @Test
    void anchor_mutations_return_new_values_and_bump_updated_at() {
        var md = new LinkedHashMap<String, MetadataValue>();
        md.put("b", MetadataValue.of(1));
        md.put("a", MetadataValue.of(2));
        Anchor original = Anchor.create(UUID.randomUUID(), UUID.randomUUID(), Transform.identity(), md, at(0));

        Anchor moved = original.withTransform(Transform.translation(1, 1, 1), at(5));
        assertEquals(Transform.identity(), original.transform());
        assertEquals(at(0), original.updatedAt());
        assertEquals(at(5), moved.updatedAt());
        assertEquals(at(0), moved.createdAt());

        Anchor edited = original.withMetadataValue("b", MetadataValue.of(9), at(6));
        assertEquals(List.of("b", "a"), List.copyOf(edited.metadata().keySet()));
        assertEquals(9L, edited.longMetadata("b").orElseThrow());

        Anchor deleted = original.markDeleted(at(7));
        assertTrue(deleted.isDeleted());
        assertEquals(at(7), deleted.updatedAt());
        Anchor restored = deleted.restore(at(8));
        assertFalse(restored.isDeleted());
        assertEquals(at(8), restored.updatedAt());

        md.put("c", MetadataValue.of(3));
        assertEquals(2, original.metadata().size(), "metadata is copied on construction");
        assertThrows(UnsupportedOperationException.class, () -> original.metadata().put("x", MetadataValue.NULL));
    }

    @Test
    void event_factories_carry_only_fields_of_their_type() {
        Anchor a = Anchor.create(UUID.randomUUID(), UUID.randomUUID(), Transform.identity(), text("t"), at(0));

        AnchorEvent created = AnchorEvent.created(a, 1, at(0));
        assertTrue(created.transformOptional().isPresent());
        assertTrue(created.metadataOptional().isPresent());

        AnchorEvent moved = AnchorEvent.moved(a, 2, at(1));
        assertTrue(moved.transformOptional().isPresent());
        assertNull(moved.metadata());

        AnchorEvent updated = AnchorEvent.updated(a, 3, at(2));
        assertNull(updated.transform());
        assertNotNull(updated.metadata());

        AnchorEvent deleted = AnchorEvent.deleted(a, 4, at(3));
        assertNull(deleted.transform());
        assertNull(deleted.metadata());
        assertFalse(deleted.isActiveState());
        assertTrue(AnchorEvent.restored(a, 5, at(4)).isActiveState());

        assertEquals("device-1", deleted.withActor("device-1").actor().orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> AnchorEvent.created(a, 0, at(0)));
    }

    @Test
    void space_copies_payload_defensively() {
        byte[] bytes = {1, 2, 3};
        Space s = new Space(UUID.randomUUID(), "lab", bytes, at(0), at(0));
        bytes[0] = 9;
        s.payload()[1] = 9;
        assertArrayEquals(new byte[]{1, 2, 3}, s.payload());
        assertEquals(3, s.payloadSize());

        Space renamed = s.withName("kitchen", at(4));
        assertEquals("kitchen", renamed.name().orElseThrow());
        assertEquals(at(4), renamed.updatedAt());
        assertEquals(at(0), renamed.createdAt());
        assertTrue(new Space(s.id(), null, bytes, at(0), at(0)).name().isEmpty());
    }
}
