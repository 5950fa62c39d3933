// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * RemoveLiquidityRequest - burn shares for the proportional reserves.
 */
public class RemoveLiquidityRequest {
    @NotBlank(message = "party is required")
    public String party;

    @NotNull(message = "shares is required")
    @PositiveOrZero(message = "shares cannot be negative")
    public BigInteger shares;

    public RemoveLiquidityRequest() {}

    public RemoveLiquidityRequest(String party, BigInteger shares) {
        this.party = party;
        this.shares = shares;
    }
}
