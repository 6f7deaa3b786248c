package io.anchorbase.engine.remote;

import io.anchorbase.core.Anchor;
import io.anchorbase.core.AnchorEvent;
import io.anchorbase.storage.StoredSpace;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Remote replica of spaces, anchors and events.
 * <p>
 * Uploads are idempotent upserts by id. Every method reports failure with
 * {@link RemoteStoreException}.
 */
public interface RemoteStore {

    void uploadSpace(StoredSpace space);

    Optional<StoredSpace> downloadSpace(UUID id);

    /** Spaces with updatedAt strictly after {@code since}. */
    List<StoredSpace> listSpacesModifiedSince(Instant since);

    /** Remove the space and its anchors. */
    void deleteSpace(UUID id);

    void uploadAnchor(Anchor anchor);

    Optional<Anchor> downloadAnchor(UUID id);

    /** Anchors with updatedAt strictly after {@code since}. */
    List<Anchor> listAnchorsModifiedSince(Instant since);

    void deleteAnchor(UUID id);

    /** Hard-delete anchors whose deletedAt is strictly before {@code before}. */
    void purgeDeletedAnchors(Instant before);

    void uploadEvent(AnchorEvent event);

    /** Events with timestamp strictly after {@code since}. */
    List<AnchorEvent> listEventsSince(Instant since);

    /** Events of one anchor in version order. */
    List<AnchorEvent> listEventsForAnchor(UUID anchorId);

    /** Remove events with timestamp strictly before {@code cutoff}. */
    void deleteEventsOlderThan(Instant cutoff);
}
