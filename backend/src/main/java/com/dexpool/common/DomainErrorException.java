// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.common;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Carries a {@link DomainError} out of a controller so the exception handler can render its code.
 */
public class DomainErrorException extends ResponseStatusException {

    private final transient DomainError error;

    public DomainErrorException(final HttpStatus status, final DomainError error) {
        super(status, error.code() + ": " + error.message());
        this.error = error;
    }

    public DomainError getError() {
        return error;
    }
}
