package com.zecinsight.api.controller;

import com.zecinsight.api.dto.ApiResponse;
import com.zecinsight.common.AccessDeniedException;
import com.zecinsight.common.InsightException;
import com.zecinsight.common.UpstreamException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.Optional;

/**
 * Maps the error taxonomy to HTTP statuses and the response envelope. Upstream, access and unexpected
 * failures reach the client with a generic message only.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    static final String UPSTREAM_MESSAGE = "Service temporarily unavailable, please try again";
    static final String INTERNAL_MESSAGE = "An unexpected error occurred";

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<ApiResponse<Void>> handleUpstream(UpstreamException ex) {
        log.warn("Upstream failure: {}", ex.getMessage(), ex);
        return ResponseEntity.status(ex.getHttpStatus()).body(ApiResponse.error(ex.getErrorCode(), UPSTREAM_MESSAGE));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ApiResponse<Void>> handleAccessDenied(AccessDeniedException ex) {
        return ResponseEntity.status(ex.getHttpStatus()).body(ApiResponse.error(ex.getErrorCode(), "Access denied"));
    }

    @ExceptionHandler(InsightException.class)
    public ResponseEntity<ApiResponse<Void>> handleInsight(InsightException ex) {
        return ResponseEntity.status(ex.getHttpStatus()).body(ApiResponse.error(ex.getErrorCode(), ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiResponse<Void>> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter("INVALID_ADDRESS"::equals)
                .orElse("VALIDATION_ERROR");
        String message = "INVALID_ADDRESS".equals(error)
                ? "Invalid Zcash address format"
                : ex.getFieldErrors().stream()
                        .findFirst()
                        .map(FieldError::getDefaultMessage)
                        .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ApiResponse.error(error, message));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiResponse<Void>> handleInput(ServerWebInputException ex) {
        return ResponseEntity.badRequest().body(ApiResponse.error("VALIDATION_ERROR",
                Optional.ofNullable(ex.getReason()).orElse("Invalid request")));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception ex) {
        log.error("Unhandled API error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.error("INTERNAL_ERROR", INTERNAL_MESSAGE));
    }
}
