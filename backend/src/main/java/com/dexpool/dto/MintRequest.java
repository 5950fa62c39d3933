// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigInteger;

/**
 * MintRequest - issue test units of one pool asset to a party.
 */
public class MintRequest {
    @NotBlank(message = "party is required")
    public String party;

    @NotBlank(message = "asset is required")
    public String asset;

    @NotNull(message = "amount is required")
    @Positive(message = "amount must be positive")
    public BigInteger amount;

    public MintRequest() {}

    public MintRequest(String party, String asset, BigInteger amount) {
        this.party = party;
        this.asset = asset;
        this.amount = amount;
    }
}
