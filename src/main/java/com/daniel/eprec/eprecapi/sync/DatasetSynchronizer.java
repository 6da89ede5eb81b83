package com.daniel.eprec.eprecapi.sync;

import java.util.Optional;

/**
 * Brings the local dataset copy up to date with its remote.
 *
 * <p>
 * Split in two so the network work runs without blocking queries:
 * {@link #prepare()} downloads (clone into staging, or fetch) with no lock held,
 * and the returned {@link PendingUpdate} swaps the snapshot under the lock.
 */
public interface DatasetSynchronizer {

    /**
     * @return the update to apply, or empty when the local copy already matches the remote
     * @throws DatasetSyncException when the remote cannot be reached or read
     */
    Optional<PendingUpdate> prepare() throws DatasetSyncException;
}
