package com.daniel.eprec.eprecapi.dataset;

// Snapshot opened, but a statement failed (missing table, bad column, driver error while iterating).
public class QueryException extends DatasetAccessException {

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
