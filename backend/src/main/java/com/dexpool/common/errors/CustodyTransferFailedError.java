// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.common.errors;

import com.dexpool.common.DomainError;

public final class CustodyTransferFailedError extends DomainError {

    private final boolean compensated;

    public CustodyTransferFailedError(final String details) {
        this(details, true);
    }

    /**
     * @param compensated false when an already-completed transfer of the same operation could not be reversed
     */
    public CustodyTransferFailedError(final String details, final boolean compensated) {
        super("CUSTODY_TRANSFER_FAILED", details, 502);
        this.compensated = compensated;
    }

    public boolean isCompensated() {
        return compensated;
    }
}
