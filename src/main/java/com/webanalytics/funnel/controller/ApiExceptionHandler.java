package com.webanalytics.funnel.controller;

import com.webanalytics.funnel.model.ApiResponse;
import com.webanalytics.funnel.model.FunnelAnalyticsException;
import com.webanalytics.funnel.store.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps failures to the shared error envelope. Internal details of 5xx errors stay in the log.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(FunnelAnalyticsException.class)
    public ResponseEntity<ApiResponse<Void>> handleAnalytics(FunnelAnalyticsException e) {
        HttpStatus status = e.getKind().status();
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", e.getKind(), e.getMessage(), e);
        } else {
            log.warn("Request rejected with {}: {}", e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(ApiResponse.failure(e.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiResponse<Void>> handleMissingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity.badRequest()
                .body(ApiResponse.failure("Missing parameter " + e.getParameterName()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiResponse.failure("Malformed request body"));
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ApiResponse<Void>> handleStorage(StorageException e) {
        log.error("Storage failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.failure("Database error"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiResponse<Void>> handleUnexpected(Exception e) {
        log.error("Unexpected failure: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.failure("Internal error"));
    }
}
