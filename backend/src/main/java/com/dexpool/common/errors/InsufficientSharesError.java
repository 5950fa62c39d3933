// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.common.errors;

import com.dexpool.common.DomainError;

import java.math.BigInteger;

public final class InsufficientSharesError extends DomainError {

    private final BigInteger requested;
    private final BigInteger held;

    public InsufficientSharesError(final BigInteger requested, final BigInteger held) {
        super("INSUFFICIENT_SHARES",
                "Requested " + requested + " shares but only " + held + " are held", 422);
        this.requested = requested;
        this.held = held;
    }

    public BigInteger requested() {
        return requested;
    }

    public BigInteger held() {
        return held;
    }
}
