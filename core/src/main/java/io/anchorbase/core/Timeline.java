// file: src/main/java/io/anchorbase/core/Timeline.java
package io.anchorbase.core;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Ordered event history of one space, used to reconstruct anchor state at any instant.
 * <p>
 * Events are sorted by timestamp on construction. The sort is stable, so events that
 * share a timestamp keep their log (insertion) order. A Timeline is derived on demand
 * from the event log and never persisted.
 * <p>
 * Reconstruction ({@link #stateAt}):
 *  1) keep events with timestamp <= date,
 *  2) fold them per anchor in timestamp order,
 *  3) drop anchors whose folded state is deleted.
 */
public final class Timeline {
    private final UUID spaceId;
    private final List<AnchorEvent> events;

    public Timeline(UUID spaceId, List<AnchorEvent> events) {
        this.spaceId = Objects.requireNonNull(spaceId, "spaceId");
        var sorted = new ArrayList<>(Objects.requireNonNull(events, "events"));
        sorted.sort(Comparator.comparing(AnchorEvent::timestamp));
        this.events = List.copyOf(sorted);
    }

    public UUID spaceId() { return spaceId; }

    /** All events in timestamp order. */
    public List<AnchorEvent> events() { return events; }

    public boolean isEmpty() { return events.isEmpty(); }

    // ---------- bounds ----------

    public Optional<Instant> startDate() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(0).timestamp());
    }

    public Optional<Instant> endDate() {
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(events.size() - 1).timestamp());
    }

    public Optional<Duration> duration() {
        if (events.isEmpty()) return Optional.empty();
        return Optional.of(Duration.between(startDate().orElseThrow(), endDate().orElseThrow()));
    }

    // ---------- queries ----------

    public Set<UUID> anchorIds() {
        var ids = new LinkedHashSet<UUID>();
        for (AnchorEvent e : events) ids.add(e.anchorId());
        return ids;
    }

    public List<AnchorEvent> eventsFor(UUID anchorId) {
        return events.stream().filter(e -> e.anchorId().equals(anchorId)).toList();
    }

    /** Events with from <= timestamp <= to. */
    public List<AnchorEvent> eventsBetween(Instant from, Instant to) {
        return events.stream()
                .filter(e -> !e.timestamp().isBefore(from) && !e.timestamp().isAfter(to))
                .toList();
    }

    public List<AnchorEvent> eventsOfType(EventType type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    // ---------- reconstruction ----------

    /**
     * Anchors visible at {@code date}, in order of first appearance in the timeline.
     * Returned anchors always have deletedAt == null.
     */
    public List<Anchor> stateAt(Instant date) {
        Objects.requireNonNull(date, "date");
        Map<UUID, AnchorFold.State> states = new LinkedHashMap<>();

        for (AnchorEvent e : events) {
            if (e.timestamp().isAfter(date)) {
                break; // sorted: nothing later can qualify
            }
            AnchorFold.State next = AnchorFold.apply(states.get(e.anchorId()), e);
            if (next != null) {
                states.put(e.anchorId(), next);
            }
        }

        List<Anchor> visible = new ArrayList<>(states.size());
        for (AnchorFold.State s : states.values()) {
            if (!s.inactive()) visible.add(s.anchor());
        }
        return visible;
    }

    /** Compare the visible state at two instants. */
    public Diff diff(Instant from, Instant to) {
        return Diff.compute(spaceId, from, to, stateAt(from), stateAt(to));
    }

    // ---------- navigation helpers ----------

    /**
     * Evenly spaced instants between {@code from} and {@code to} (defaults: timeline bounds),
     * both ends included. Returns a single instant when the range is empty or steps <= 1.
     */
    public List<Instant> scrubberDates(Instant from, Instant to, int steps) {
        Instant now = Instant.now();
        Instant start = from != null ? from : startDate().orElse(now);
        Instant end = to != null ? to : endDate().orElse(now);

        if (!start.isBefore(end) || steps <= 1) {
            return List.of(start);
        }

        long spanNanos = Duration.between(start, end).toNanos();
        List<Instant> out = new ArrayList<>(steps);
        for (int i = 0; i < steps - 1; i++) {
            out.add(start.plusNanos(spanNanos / (steps - 1) * i));
        }
        out.add(end);
        return out;
    }

    /** Event whose timestamp is closest to {@code date}; the earliest one wins ties. */
    public Optional<AnchorEvent> closestEvent(Instant date) {
        AnchorEvent best = null;
        Duration bestGap = null;
        for (AnchorEvent e : events) {
            Duration gap = Duration.between(e.timestamp(), date).abs();
            if (bestGap == null || gap.compareTo(bestGap) < 0) {
                best = e;
                bestGap = gap;
            }
        }
        return Optional.ofNullable(best);
    }

    /** First event timestamp of every calendar day (UTC) that saw activity. */
    public List<Instant> significantDates() {
        return significantDates(ZoneOffset.UTC);
    }

    public List<Instant> significantDates(ZoneId zone) {
        var seenDays = new HashSet<LocalDate>();
        List<Instant> out = new ArrayList<>();
        for (AnchorEvent e : events) {
            if (seenDays.add(LocalDate.ofInstant(e.timestamp(), zone))) {
                out.add(e.timestamp());
            }
        }
        return out;
    }
}
