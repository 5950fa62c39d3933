// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.common.errors;

import com.dexpool.common.DomainError;

public final class InsufficientOutputError extends DomainError {

    public InsufficientOutputError(final String details) {
        super("INSUFFICIENT_OUTPUT", details, 422);
    }
}
