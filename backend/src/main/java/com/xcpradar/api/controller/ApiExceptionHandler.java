package com.xcpradar.api.controller;

import com.xcpradar.api.dto.ErrorBody;
import com.xcpradar.ingestion.adapter.LedgerException;
import com.xcpradar.ingestion.store.StoreNotInitializedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps failures to ErrorBody (error, message, timestamp): bad input 400, ledger unavailable 502,
 * store not ready 503.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorBody> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getReason()));
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorBody> handleLedger(LedgerException ex) {
        log.warn("Ledger request failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorBody.of("LEDGER_UNAVAILABLE", "Counterparty API request failed"));
    }

    @ExceptionHandler(StoreNotInitializedException.class)
    public ResponseEntity<ErrorBody> handleStoreNotReady(StoreNotInitializedException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("STORE_UNAVAILABLE", ex.getMessage()));
    }
}
