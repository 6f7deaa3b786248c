package io.anchorbase.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static io.anchorbase.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class TimelineTest {

    private final UUID space = UUID.randomUUID();

    @Test
    void state_before_first_event_is_empty() {
        Anchor a = anchor(space, Transform.identity(), text("hello"), at(10));
        var timeline = new Timeline(space, List.of(AnchorEvent.created(a, 1, at(10))));

        assertTrue(timeline.stateAt(at(9)).isEmpty());
        assertEquals(1, timeline.stateAt(at(10)).size(), "events at exactly the instant are included");
    }

    @Test
    void state_folds_moves_and_updates_in_timestamp_order() {
        Anchor a = anchor(space, Transform.identity(), text("v1"), at(0));
        Anchor moved = a.withTransform(Transform.translation(1, 2, 3), at(5));
        Anchor updated = moved.withMetadata(text("v2"), at(8));

        // log order deliberately differs from timestamp order
        var timeline = new Timeline(space, List.of(
                AnchorEvent.updated(updated, 3, at(8)),
                AnchorEvent.created(a, 1, at(0)),
                AnchorEvent.moved(moved, 2, at(5))));

        Anchor atSix = timeline.stateAt(at(6)).get(0);
        assertEquals(Transform.translation(1, 2, 3), atSix.transform());
        assertEquals("v1", atSix.stringMetadata("text").orElseThrow());
        assertEquals(at(5), atSix.updatedAt());
        assertEquals(at(0), atSix.createdAt());

        Anchor latest = timeline.stateAt(at(100)).get(0);
        assertEquals("v2", latest.stringMetadata("text").orElseThrow());
        assertEquals(at(8), latest.updatedAt());
        assertNull(latest.deletedAt());
    }

    @Test
    void deleted_anchor_disappears_and_restored_anchor_returns() {
        Anchor a = anchor(space, Transform.identity(), text("x"), at(0));
        Anchor restored = a.withTransform(Transform.translation(9, 9, 9), at(20));

        var timeline = new Timeline(space, List.of(
                AnchorEvent.created(a, 1, at(0)),
                AnchorEvent.deleted(a, 2, at(10)),
                AnchorEvent.restored(restored, 3, at(20))));

        assertEquals(1, timeline.stateAt(at(5)).size());
        assertTrue(timeline.stateAt(at(15)).isEmpty());

        List<Anchor> after = timeline.stateAt(at(25));
        assertEquals(1, after.size());
        assertEquals(Transform.translation(9, 9, 9), after.get(0).transform());
        assertEquals(at(20), after.get(0).updatedAt());
    }

    @Test
    void events_without_preceding_created_are_dropped() {
        Anchor a = anchor(space, Transform.identity(), Map.of(), at(0));
        var timeline = new Timeline(space, List.of(
                AnchorEvent.moved(a.withTransform(Transform.translation(1, 0, 0), at(1)), 2, at(1)),
                AnchorEvent.updated(a.withMetadata(text("orphan"), at(2)), 3, at(2))));

        assertTrue(timeline.stateAt(at(100)).isEmpty());
    }

    @Test
    void equal_timestamps_keep_log_order() {
        Anchor a = anchor(space, Transform.identity(), text("first"), at(0));
        Anchor b = a.withMetadata(text("second"), at(0));

        var timeline = new Timeline(space, List.of(
                AnchorEvent.created(a, 1, at(0)),
                AnchorEvent.updated(b, 2, at(0))));

        assertEquals("second", timeline.stateAt(at(0)).get(0).stringMetadata("text").orElseThrow());
    }

    @Test
    void state_lists_anchors_in_first_appearance_order() {
        Anchor first = anchor(space, Transform.identity(), Map.of(), at(1));
        Anchor second = anchor(space, Transform.identity(), Map.of(), at(2));
        var timeline = new Timeline(space, List.of(
                AnchorEvent.created(second, 1, at(2)),
                AnchorEvent.created(first, 1, at(1))));

        List<Anchor> state = timeline.stateAt(at(3));
        assertEquals(first.id(), state.get(0).id());
        assertEquals(second.id(), state.get(1).id());
    }

    @Test
    void bounds_and_duration_follow_sorted_events() {
        Anchor a = anchor(space, Transform.identity(), Map.of(), at(0));
        var timeline = new Timeline(space, List.of(
                AnchorEvent.deleted(a, 2, at(30)),
                AnchorEvent.created(a, 1, at(0))));

        assertEquals(at(0), timeline.startDate().orElseThrow());
        assertEquals(at(30), timeline.endDate().orElseThrow());
        assertEquals(Duration.ofSeconds(30), timeline.duration().orElseThrow());

        var empty = new Timeline(space, List.of());
        assertTrue(empty.startDate().isEmpty());
        assertTrue(empty.duration().isEmpty());
        assertTrue(empty.stateAt(at(0)).isEmpty());
    }

    @Test
    void queries_filter_by_anchor_range_and_type() {
        Anchor a = anchor(space, Transform.identity(), Map.of(), at(0));
        Anchor b = anchor(space, Transform.identity(), Map.of(), at(5));
        var timeline = new Timeline(space, List.of(
                AnchorEvent.created(a, 1, at(0)),
                AnchorEvent.created(b, 1, at(5)),
                AnchorEvent.moved(a.withTransform(Transform.translation(1, 1, 1), at(10)), 2, at(10))));

        assertEquals(2, timeline.eventsFor(a.id()).size());
        assertEquals(2, timeline.eventsBetween(at(5), at(10)).size());
        assertEquals(2, timeline.eventsOfType(EventType.CREATED).size());
        assertEquals(List.of(a.id(), b.id()), List.copyOf(timeline.anchorIds()));
    }

    @Test
    void scrubber_dates_are_evenly_spaced_and_include_both_ends() {
        var timeline = new Timeline(space, List.of());
        List<Instant> dates = timeline.scrubberDates(at(0), at(100), 5);

        assertEquals(List.of(at(0), at(25), at(50), at(75), at(100)), dates);
        assertEquals(List.of(at(7)), timeline.scrubberDates(at(7), at(7), 10));
        assertEquals(List.of(at(0)), timeline.scrubberDates(at(0), at(10), 1));
    }

    @Test
    void closest_event_and_significant_dates() {
        Anchor a = anchor(space, Transform.identity(), Map.of(), at(0));
        Instant nextDay = at(0).plus(Duration.ofDays(1));
        var timeline = new Timeline(space, List.of(
                AnchorEvent.created(a, 1, at(0)),
                AnchorEvent.updated(a.withMetadata(text("later"), at(60)), 2, at(60)),
                AnchorEvent.deleted(a, 3, nextDay)));

        assertEquals(2, timeline.closestEvent(at(50)).orElseThrow().version());
        assertEquals(List.of(at(0), nextDay), timeline.significantDates());
        assertTrue(new Timeline(space, List.of()).closestEvent(at(0)).isEmpty());
    }
}
