package io.github.samzhu.modelprice.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import io.github.samzhu.modelprice.dto.api.ErrorResponse;
import io.github.samzhu.modelprice.exception.InvalidQueryException;
import io.github.samzhu.modelprice.exception.ModelNotFoundException;
import io.github.samzhu.modelprice.exception.ProviderFetchException;
import io.github.samzhu.modelprice.exception.UnknownProviderException;

/**
 * API 例外轉換。
 *
 * <ul>
 *   <li>{@link UnknownProviderException}、{@link InvalidQueryException} → 400</li>
 *   <li>{@link ModelNotFoundException} → 404</li>
 *   <li>{@link ProviderFetchException} → 502（上游失敗）</li>
 *   <li>其他 {@link RuntimeException} → 500</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnknownProviderException.class)
    public ResponseEntity<ErrorResponse> handleUnknownProvider(UnknownProviderException ex) {
        return ResponseEntity
            .badRequest()
            .body(ErrorResponse.of("unknown_provider", ex.getMessage()));
    }

    @ExceptionHandler(InvalidQueryException.class)
    public ResponseEntity<ErrorResponse> handleInvalidQuery(InvalidQueryException ex) {
        return ResponseEntity
            .badRequest()
            .body(ErrorResponse.of("invalid_query", ex.getMessage()));
    }

    @ExceptionHandler(ModelNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleModelNotFound(ModelNotFoundException ex) {
        return ResponseEntity
            .status(HttpStatus.NOT_FOUND)
            .body(ErrorResponse.of("not_found", ex.getMessage()));
    }

    @ExceptionHandler(ProviderFetchException.class)
    public ResponseEntity<ErrorResponse> handleProviderFetch(ProviderFetchException ex) {
        log.warn("Refresh failed: provider={}, error={}", ex.getProviderName(), ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(ErrorResponse.of("provider_fetch_failed", ex.getMessage()));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleRuntimeException(RuntimeException ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.of("internal_error", "Unexpected error: " + ex.getMessage()));
    }
}
