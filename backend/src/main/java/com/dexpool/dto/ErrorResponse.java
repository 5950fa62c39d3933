// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Error body returned by every endpoint.
 *
 * Example:
 * {
 *   "error": "RATIO_MISMATCH",
 *   "message": "Deposit 50/90 does not match reserve ratio 100/200",
 *   "timestamp": "2025-10-21T15:30:45.123Z",
 *   "path": "/api/pool/liquidity/add",
 *   "status": 409
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Error code (uppercase snake_case), the DomainError code where there is one.
     */
    private String error;

    private String message;

    /**
     * ISO-8601 timestamp when the error occurred.
     */
    private String timestamp;

    private String path;

    private int status;

    /**
     * Echo of the X-Request-ID header, if the caller sent one.
     */
    private String requestId;

    /**
     * Field errors for bean-validation failures.
     */
    private Object details;

    public ErrorResponse() {
        this.timestamp = Instant.now().toString();
    }

    public ErrorResponse(String error, String message, int status, String path) {
        this();
        this.error = error;
        this.message = message;
        this.status = status;
        this.path = path;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

    public int getStatus() {
        return status;
    }

    public void setStatus(int status) {
        this.status = status;
    }

    public String getRequestId() {
        return requestId;
    }

    public void setRequestId(String requestId) {
        this.requestId = requestId;
    }

    public Object getDetails() {
        return details;
    }

    public void setDetails(Object details) {
        this.details = details;
    }
}
