// file: src/main/java/io/anchorbase/core/ConflictResolver.java
package io.anchorbase.core;

/**
 * Policy for choosing between a local record and a remote copy of the same record.
 * <p>
 * Used only during the download phase of a sync. Wall-clock timestamps are the only
 * ordering information available; there is no causal metadata.
 */
public interface ConflictResolver<T extends Timestamped> {

    /**
     * Choose the record to keep.
     *
     * @param local  the local record, or null when the id is unknown locally
     * @param remote the remote record, never null
     */
    T choose(T local, T remote);

    /** Convenience: true when {@link #choose} would replace the local record. */
    default boolean remoteWins(T local, T remote) {
        return choose(local, remote) == remote && local != remote;
    }

    /**
     * Last-write-wins by updatedAt.
     * <p>
     *  - Records absent locally are always adopted.
     *  - Remote replaces local only when strictly newer; equal timestamps keep local.
     */
    final class LastWriteWins<T extends Timestamped> implements ConflictResolver<T> {
        @Override public T choose(T local, T remote) {
            if (remote == null) throw new IllegalArgumentException("remote must not be null");
            if (local == null) return remote;
            return remote.updatedAt().isAfter(local.updatedAt()) ? remote : local;
        }
    }
}
