// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.common.errors;

import com.dexpool.common.DomainError;

public final class ValidationError extends DomainError {

    public ValidationError(final String details) {
        super("VALIDATION_ERROR", details, 400);
    }
}
