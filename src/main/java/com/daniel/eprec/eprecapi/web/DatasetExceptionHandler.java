package com.daniel.eprec.eprecapi.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice; // Applies these handlers to every controller.

import com.daniel.eprec.eprecapi.dataset.QueryException;
import com.daniel.eprec.eprecapi.dataset.StorageOpenException;

@RestControllerAdvice
// Snapshot failures become a plain-text 500; no partial JSON is ever written.
public class DatasetExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(DatasetExceptionHandler.class);

    @ExceptionHandler(StorageOpenException.class)
    public ResponseEntity<String> storageOpenFailed(StorageOpenException ex) {
        log.warn("Snapshot open failed: {}", ex.getMessage());
        return serverError("DB open error");
    }

    @ExceptionHandler(QueryException.class)
    public ResponseEntity<String> queryFailed(QueryException ex) {
        log.warn("Snapshot query failed: {}", ex.getMessage(), ex.getCause());
        return serverError("DB query error");
    }

    private ResponseEntity<String> serverError(String body) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .contentType(MediaType.TEXT_PLAIN)
                .body(body);
    }
}
