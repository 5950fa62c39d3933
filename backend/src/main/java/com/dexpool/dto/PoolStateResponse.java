// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

import com.dexpool.engine.PoolState;

/**
 * Reserves and share supply of the pool. Amounts are decimal strings.
 */
public class PoolStateResponse {
    public final String assetA;
    public final String assetB;
    public final String reserveA;
    public final String reserveB;
    public final String totalShares;

    public PoolStateResponse(String assetA, String assetB, String reserveA, String reserveB, String totalShares) {
        this.assetA = assetA;
        this.assetB = assetB;
        this.reserveA = reserveA;
        this.reserveB = reserveB;
        this.totalShares = totalShares;
    }

    public static PoolStateResponse of(String assetA, String assetB, PoolState state) {
        return new PoolStateResponse(
            assetA,
            assetB,
            state.reserveA().toString(),
            state.reserveB().toString(),
            state.totalShares().toString()
        );
    }
}
