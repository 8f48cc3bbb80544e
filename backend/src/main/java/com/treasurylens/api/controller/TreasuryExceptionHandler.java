package com.treasurylens.api.controller;

import com.treasurylens.api.dto.ErrorBody;
import com.treasurylens.common.CircuitOpenException;
import com.treasurylens.common.TreasuryDataException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps data-layer failures to ErrorBody responses: circuit open 503 with Retry-After, upstream 502,
 * undecodable data 422, missing configuration 500, unsupported chain or bad parameter 400.
 */
@RestControllerAdvice
@Slf4j
public class TreasuryExceptionHandler {

    @ExceptionHandler(TreasuryDataException.class)
    public ResponseEntity<ErrorBody> handleDataException(TreasuryDataException ex) {
        return switch (ex.getKind()) {
            case CIRCUIT_OPEN -> {
                long seconds = ex instanceof CircuitOpenException open
                        ? Math.max(1L, (open.getRetryAfter().toMillis() + 999L) / 1000L)
                        : 1L;
                yield ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                        .header(HttpHeaders.RETRY_AFTER, Long.toString(seconds))
                        .body(ErrorBody.of("CIRCUIT_OPEN", ex.getMessage()));
            }
            case UPSTREAM -> {
                log.warn("Upstream failure: {}", ex.getMessage());
                yield ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorBody.of("UPSTREAM_ERROR", ex.getMessage()));
            }
            case DECODE -> ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .body(ErrorBody.of("DECODE_ERROR", ex.getMessage()));
            case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("NOT_FOUND", ex.getMessage()));
            case CONFIG -> {
                log.error("Configuration error: {}", ex.getMessage());
                yield ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(ErrorBody.of("CONFIG_ERROR", ex.getMessage()));
            }
        };
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorBody> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }
}
