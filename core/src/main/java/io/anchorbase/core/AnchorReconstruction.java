package io.anchorbase.core;

import io.anchorbase.core.error.ReconstructionFailedException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Rebuilds one anchor's state as of a given version of its history.
 * <p>
 * Unlike {@link Timeline#stateAt}, which tolerates partial event sets, this is strict:
 * the first event at or below the target version must be CREATED, otherwise the
 * history is unusable and {@link ReconstructionFailedException} is thrown.
 * <p>
 * The returned anchor keeps deletedAt set when the folded state is deleted;
 * callers that restore it decide whether to clear the flag.
 */
public final class AnchorReconstruction {

    private AnchorReconstruction() {
        // utility
    }

    public static Anchor reconstruct(UUID anchorId, List<AnchorEvent> history, int toVersion) {
        Objects.requireNonNull(anchorId, "anchorId");
        Objects.requireNonNull(history, "history");

        List<AnchorEvent> relevant = new ArrayList<>();
        for (AnchorEvent e : history) {
            if (e.anchorId().equals(anchorId) && e.version() <= toVersion) {
                relevant.add(e);
            }
        }
        relevant.sort(Comparator.comparingInt(AnchorEvent::version));

        if (relevant.isEmpty() || relevant.get(0).type() != EventType.CREATED) {
            throw new ReconstructionFailedException(anchorId);
        }

        AnchorFold.State state = null;
        for (AnchorEvent e : relevant) {
            state = AnchorFold.apply(state, e);
        }
        return state.anchor();
    }
}
