package com.daniel.eprec.eprecapi.sync;

/**
 * The filesystem half of a refresh, prepared by {@link DatasetSynchronizer#prepare()}.
 * {@link #apply()} is only called while the dataset access ticket is held.
 */
public interface PendingUpdate {

    String description();

    RefreshOutcome apply() throws DatasetSyncException;
}
