package io.anchorbase.core;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static io.anchorbase.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class DiffTest {

    private final UUID space = UUID.randomUUID();

    @Test
    void detects_added_and_removed_anchors() {
        Anchor gone = anchor(space, Transform.identity(), Map.of(), at(0));
        Anchor fresh = anchor(space, Transform.identity(), Map.of(), at(10));
        var timeline = new Timeline(space, List.of(
                AnchorEvent.created(gone, 1, at(0)),
                AnchorEvent.deleted(gone, 2, at(10)),
                AnchorEvent.created(fresh, 1, at(10))));

        Diff diff = timeline.diff(at(5), at(15));

        assertEquals(List.of(fresh.id()), diff.added().stream().map(Anchor::id).toList());
        assertEquals(List.of(gone.id()), diff.removed().stream().map(Anchor::id).toList());
        assertEquals(2, diff.changeCount());
        assertTrue(diff.hasChanges());
        assertEquals("1 added, 1 removed", diff.summary());
    }

    @Test
    void transform_change_wins_over_metadata_change() {
        Anchor a = anchor(space, Transform.translation(0, 0, 0), text("before"), at(0));
        Anchor both = a.withTransform(Transform.translation(3, 4, 0), at(5))
                .withMetadata(text("after"), at(6));
        var timeline = new Timeline(space, List.of(
                AnchorEvent.created(a, 1, at(0)),
                AnchorEvent.moved(both, 2, at(5)),
                AnchorEvent.updated(both, 3, at(6))));

        Diff diff = timeline.diff(at(1), at(10));

        assertEquals(1, diff.moved().size());
        assertTrue(diff.updated().isEmpty());
        Diff.MovedAnchor m = diff.moved().get(0);
        assertEquals(Transform.translation(0, 0, 0), m.previousTransform());
        assertEquals(5.0, m.distanceMoved(), 1e-9);
    }

    @Test
    void metadata_only_change_is_reported_as_updated_with_key_sets() {
        var before = new LinkedHashMap<String, MetadataValue>();
        before.put("keep", MetadataValue.of(1));
        before.put("drop", MetadataValue.of(true));
        before.put("edit", MetadataValue.of("old"));
        Anchor a = anchor(space, Transform.identity(), before, at(0));
        Anchor changed = a.withoutMetadataValue("drop", at(5))
                .withMetadataValue("edit", MetadataValue.of("new"), at(5))
                .withMetadataValue("add", MetadataValue.nullValue(), at(5));
        var timeline = new Timeline(space, List.of(
                AnchorEvent.created(a, 1, at(0)),
                AnchorEvent.updated(changed, 2, at(5))));

        Diff diff = timeline.diff(at(0), at(5));

        assertEquals(1, diff.updated().size());
        Diff.UpdatedAnchor u = diff.updated().get(0);
        assertEquals(Set.of("add"), u.addedKeys());
        assertEquals(Set.of("drop"), u.removedKeys());
        assertEquals(Set.of("edit"), u.changedKeys());
        assertEquals(before, u.previousMetadata());
        assertEquals("1 updated", diff.summary());
    }

    @Test
    void same_instant_never_has_changes() {
        Anchor a = anchor(space, Transform.identity(), Map.of(), at(0));
        var timeline = new Timeline(space, List.of(
                AnchorEvent.created(a, 1, at(0)),
                AnchorEvent.moved(a.withTransform(Transform.translation(1, 0, 0), at(3)), 2, at(3))));

        for (long t : new long[]{-1, 0, 3, 50}) {
            Diff diff = timeline.diff(at(t), at(t));
            assertFalse(diff.hasChanges(), "t=" + t);
            assertEquals("No changes", diff.summary());
        }
        assertEquals(1, timeline.diff(at(50), at(50)).unchanged().size());
    }

    @Test
    void current_and_previous_anchor_views() {
        Anchor stays = anchor(space, Transform.identity(), Map.of(), at(0));
        Anchor goes = anchor(space, Transform.identity(), Map.of(), at(0));
        Anchor comes = anchor(space, Transform.identity(), Map.of(), at(5));
        var timeline = new Timeline(space, List.of(
                AnchorEvent.created(stays, 1, at(0)),
                AnchorEvent.created(goes, 1, at(0)),
                AnchorEvent.deleted(goes, 2, at(5)),
                AnchorEvent.created(comes, 1, at(5))));

        Diff diff = timeline.diff(at(1), at(6));

        assertEquals(Set.of(stays.id(), comes.id()),
                Set.copyOf(diff.currentAnchors().stream().map(Anchor::id).toList()));
        assertEquals(Set.of(stays.id(), goes.id()),
                Set.copyOf(diff.previousAnchors().stream().map(Anchor::id).toList()));
    }
}
