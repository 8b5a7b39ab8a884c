package com.escrowmart.api.error;

import com.escrowmart.core.domain.MarketError;
import com.escrowmart.core.domain.MarketplaceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps marketplace rejections to HTTP responses carrying the stable error code.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MarketplaceException.class)
    public ResponseEntity<ErrorResponse> handleMarketplace(MarketplaceException ex) {
        MarketError error = ex.getError();
        HttpStatus status = statusFor(error.category());
        if (error.category() == MarketError.Category.AUTHORIZATION) {
            log.warn("Rejected: {} ({})", error, ex.getMessage());
        } else {
            log.debug("Rejected: {} ({})", error, ex.getMessage());
        }
        return ResponseEntity.status(status).body(ErrorResponse.of(error, ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(new ErrorResponse(0, "VALIDATION_FAILED", "VALUE", message));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
        return ResponseEntity.badRequest().body(new ErrorResponse(0, "BAD_REQUEST", "VALUE", ex.getMessage()));
    }

    @ExceptionHandler({ObjectOptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ErrorResponse> handleConflict(Exception ex) {
        log.warn("Concurrent modification rejected: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse(0, "CONCURRENT_MODIFICATION", "STATE", "Concurrent update, retry the request"));
    }

    static HttpStatus statusFor(MarketError.Category category) {
        return switch (category) {
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case STATE, TIMING -> HttpStatus.CONFLICT;
            case VALUE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
        };
    }

    public record ErrorResponse(int code, String error, String category, String message) {
        static ErrorResponse of(MarketError error, String message) {
            return new ErrorResponse(error.code(), error.name(), error.category().name(), message);
        }
    }
}
