// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.engine;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Immutable snapshot of the pool's reserves and total shares.
 *
 * Both reserves are zero exactly when {@code totalShares} is zero.
 */
public record PoolState(BigInteger reserveA, BigInteger reserveB, BigInteger totalShares) {

    public static final PoolState EMPTY = new PoolState(BigInteger.ZERO, BigInteger.ZERO, BigInteger.ZERO);

    public PoolState {
        Objects.requireNonNull(reserveA, "reserveA");
        Objects.requireNonNull(reserveB, "reserveB");
        Objects.requireNonNull(totalShares, "totalShares");
        if (reserveA.signum() < 0 || reserveB.signum() < 0 || totalShares.signum() < 0) {
            throw new IllegalStateException("Pool state cannot go negative: " + reserveA + "/" + reserveB + "/" + totalShares);
        }
        boolean empty = totalShares.signum() == 0;
        if (empty != (reserveA.signum() == 0) || empty != (reserveB.signum() == 0)) {
            throw new IllegalStateException("Reserves must be zero exactly when total shares are zero: "
                    + reserveA + "/" + reserveB + "/" + totalShares);
        }
    }

    public boolean hasLiquidity() {
        return totalShares.signum() > 0;
    }

    public Reserves reserves() {
        return new Reserves(reserveA, reserveB);
    }

    PoolState afterSwap(final SwapDirection direction, final BigInteger amountIn, final BigInteger amountOut) {
        if (direction.isAToB()) {
            return new PoolState(reserveA.add(amountIn), reserveB.subtract(amountOut), totalShares);
        }
        return new PoolState(reserveA.subtract(amountOut), reserveB.add(amountIn), totalShares);
    }
}
