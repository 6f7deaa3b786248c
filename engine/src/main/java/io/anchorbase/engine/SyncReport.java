package io.anchorbase.engine;

import io.anchorbase.storage.PendingOperation;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one {@link StorageEngine#sync()} run.
 *
 * @param since             lower bound used for the upload and download phases
 * @param completedAt       engine clock at the end of the run
 * @param replayed          queued operations that succeeded this time
 * @param stillPending      queued operations kept for a later run
 * @param dropped           queued operations given up on during this run
 * @param uploadedSpaces    local spaces pushed
 * @param uploadedAnchors   local anchors pushed
 * @param uploadedEvents    local events pushed
 * @param downloadedSpaces  remote spaces adopted locally
 * @param downloadedAnchors remote anchors adopted locally
 * @param downloadedEvents  remote events appended to the histories of adopted anchors
 */
public record SyncReport(
        Instant since,
        Instant completedAt,
        int replayed,
        int stillPending,
        List<PendingOperation> dropped,
        int uploadedSpaces,
        int uploadedAnchors,
        int uploadedEvents,
        int downloadedSpaces,
        int downloadedAnchors,
        int downloadedEvents
) {
    public SyncReport {
        dropped = List.copyOf(dropped);
    }

    public boolean droppedAny() { return !dropped.isEmpty(); }
}
