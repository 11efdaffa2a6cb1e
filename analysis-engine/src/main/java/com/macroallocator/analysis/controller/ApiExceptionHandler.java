package com.macroallocator.analysis.controller;

import com.macroallocator.analysis.dto.ErrorResponse;
import com.macroallocator.common.exception.AllocatorException;
import com.macroallocator.common.exception.InputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps failures onto the {@code {status: "error", message}} contract. Only input problems
 * are described to the caller; everything else gets a fixed message and a server-side log.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INTERNAL_MESSAGE = "Internal error while analyzing the narrative";
    static final String MALFORMED_MESSAGE = "Request body must be a JSON object with a \"text\" field";

    @ExceptionHandler(InputException.class)
    public ResponseEntity<ErrorResponse> badInput(InputException ex) {
        log.info("Rejected input. component={} reason={}", ex.getComponent(), ex.getReason());
        return ResponseEntity.badRequest().body(ErrorResponse.of(ex.getReason()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> malformed(ServerWebInputException ex) {
        log.info("Malformed request body. reason={}", ex.getReason());
        return ResponseEntity.badRequest().body(ErrorResponse.of(MALFORMED_MESSAGE));
    }

    @ExceptionHandler(AllocatorException.class)
    public ResponseEntity<ErrorResponse> allocatorFailure(AllocatorException ex) {
        log.error("Analysis failed. component={}", ex.getComponent(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(INTERNAL_MESSAGE));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> internal(Exception ex) {
        log.error("Unhandled failure", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(INTERNAL_MESSAGE));
    }
}
