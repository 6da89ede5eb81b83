package com.daniel.eprec.eprecapi.dataset;

// Base type for snapshot read failures. Both subtypes end up as HTTP 500 for the caller.
public abstract class DatasetAccessException extends RuntimeException {

    protected DatasetAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
