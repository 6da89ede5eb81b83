package com.daniel.eprec.eprecapi.dataset;

// Snapshot file missing or not openable as a SQLite database.
public class StorageOpenException extends DatasetAccessException {

    public StorageOpenException(String message, Throwable cause) {
        super(message, cause);
    }
}
