// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

/**
 * AddLiquidityRequest - deposit both assets into the pool.
 * Zero amounts pass validation so the engine can answer ZERO_AMOUNT.
 */
public class AddLiquidityRequest {
    @NotBlank(message = "party is required")
    public String party;

    @NotNull(message = "amountA is required")
    @PositiveOrZero(message = "amountA cannot be negative")
    public BigInteger amountA;

    @NotNull(message = "amountB is required")
    @PositiveOrZero(message = "amountB cannot be negative")
    public BigInteger amountB;

    // Default constructor for Jackson
    public AddLiquidityRequest() {}

    public AddLiquidityRequest(String party, BigInteger amountA, BigInteger amountB) {
        this.party = party;
        this.amountA = amountA;
        this.amountB = amountB;
    }
}
