// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.common.errors;

import com.dexpool.common.DomainError;

public final class ZeroSwapAmountError extends DomainError {

    public ZeroSwapAmountError(final String details) {
        super("ZERO_SWAP_AMOUNT", details, 400);
    }
}
