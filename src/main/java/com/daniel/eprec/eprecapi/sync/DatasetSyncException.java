package com.daniel.eprec.eprecapi.sync;

// Clone, fetch or fast-forward failure. Never leaves RefreshScheduler.
public class DatasetSyncException extends Exception {

    public DatasetSyncException(String message) {
        super(message);
    }

    public DatasetSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
