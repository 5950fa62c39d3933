// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.config;

import com.dexpool.common.DomainError;
import com.dexpool.common.DomainErrorException;
import com.dexpool.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Global exception handler for all REST controllers.
 *
 * Provides standardized error responses across all endpoints:
 * - DomainErrorException (pool rejections, keeps the domain error code)
 * - ResponseStatusException (other 4xx/5xx errors)
 * - Validation and request-parsing errors (400 Bad Request)
 * - Generic exceptions (500 Internal Server Error)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DomainErrorException.class)
    public ResponseEntity<ErrorResponse> handleDomainErrorException(
            DomainErrorException ex,
            HttpServletRequest request
    ) {
        DomainError error = ex.getError();
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        ErrorResponse body = errorBody(error.code(), error.message(), status, request);

        if (status.is5xxServerError()) {
            logger.error("Domain error {} on {}: {}", error.code(), request.getRequestURI(), error.message());
        } else {
            logger.warn("Domain error {} on {}: {}", error.code(), request.getRequestURI(), error.message());
        }
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(
            ResponseStatusException ex,
            HttpServletRequest request
    ) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        String message = ex.getReason() != null ? ex.getReason() : status.getReasonPhrase();
        logger.warn("ResponseStatusException: {} {} - {}", status.value(), request.getRequestURI(), message);
        return ResponseEntity.status(status).body(errorBody(status.name(), message, status, request));
    }

    /**
     * Handle validation errors (e.g., @Valid annotation failures).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        Map<String, String> validationErrors = new LinkedHashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            validationErrors.put(error.getField(), error.getDefaultMessage())
        );

        ErrorResponse body = errorBody("VALIDATION_ERROR", "Request validation failed", HttpStatus.BAD_REQUEST, request);
        body.setDetails(validationErrors);

        logger.warn("Validation error on {}: {}", request.getRequestURI(), validationErrors);
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.warn("Malformed request on {}: {}", request.getRequestURI(), ex.getMessage());
        String message = ex instanceof HttpMessageNotReadableException
            ? "Request body is missing or malformed"
            : ex.getMessage();
        return ResponseEntity.badRequest()
            .body(errorBody("VALIDATION_ERROR", message, HttpStatus.BAD_REQUEST, request));
    }

    /**
     * Handle all other uncaught exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        logger.error("Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        String message = ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred";
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(errorBody("INTERNAL_SERVER_ERROR", message, HttpStatus.INTERNAL_SERVER_ERROR, request));
    }

    private ErrorResponse errorBody(String code, String message, HttpStatus status, HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(code, message, status.value(), request.getRequestURI());
        String requestId = request.getHeader("X-Request-ID");
        if (requestId != null) {
            body.setRequestId(requestId);
        }
        return body;
    }
}
