// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.engine;

import com.dexpool.util.AmmMath;

import java.math.BigInteger;

/**
 * The ordered reserve pair (reserveA, reserveB).
 */
public record Reserves(BigInteger reserveA, BigInteger reserveB) {

    public BigInteger product() {
        return AmmMath.product(reserveA, reserveB);
    }

    /**
     * Reserve paid into by a swap in {@code direction}.
     */
    public BigInteger in(final SwapDirection direction) {
        return direction.isAToB() ? reserveA : reserveB;
    }

    /**
     * Reserve paid out of by a swap in {@code direction}.
     */
    public BigInteger out(final SwapDirection direction) {
        return direction.isAToB() ? reserveB : reserveA;
    }
}
