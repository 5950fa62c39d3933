// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

import com.dexpool.engine.SwapDirection;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigInteger;

public class SwapRequest {
    @NotBlank(message = "party is required")
    public String party;

    @NotNull(message = "direction is required (A_TO_B or B_TO_A)")
    public SwapDirection direction;

    @NotNull(message = "amountIn is required")
    @PositiveOrZero(message = "amountIn cannot be negative")
    public BigInteger amountIn;

    public SwapRequest() {}

    public SwapRequest(String party, SwapDirection direction, BigInteger amountIn) {
        this.party = party;
        this.direction = direction;
        this.amountIn = amountIn;
    }
}
