// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.util;

import com.dexpool.constants.PoolConstants;

import java.math.BigInteger;

/**
 * Integer AMM math shared by the engine and the quote endpoint.
 *
 * Every division here is floor division. Rounding always favours the pool.
 */
public final class AmmMath {

    private AmmMath() {
        // Utility class
    }

    /**
     * Output of a swap against the given reserves after the 0.3% fee.
     *
     * <pre>
     * amountInWithFee = amountIn * 997
     * amountOut       = floor(amountInWithFee * reserveOut / (reserveIn * 1000 + amountInWithFee))
     * </pre>
     *
     * @param amountIn   input amount, non-negative
     * @param reserveIn  reserve of the input asset, non-negative
     * @param reserveOut reserve of the output asset, non-negative
     * @return output amount, floored
     * @throws IllegalArgumentException if an argument is null or negative, or the denominator is zero
     */
    public static BigInteger quoteOut(final BigInteger amountIn,
                                      final BigInteger reserveIn,
                                      final BigInteger reserveOut) {
        requireNonNegative(amountIn, "amountIn");
        requireNonNegative(reserveIn, "reserveIn");
        requireNonNegative(reserveOut, "reserveOut");

        BigInteger amountInWithFee = amountIn.multiply(PoolConstants.FEE_MULTIPLIER);
        BigInteger numerator = amountInWithFee.multiply(reserveOut);
        BigInteger denominator = reserveIn.multiply(PoolConstants.FEE_DENOMINATOR).add(amountInWithFee);
        if (denominator.signum() == 0) {
            throw new IllegalArgumentException("amountIn and reserveIn cannot both be zero");
        }
        return numerator.divide(denominator);
    }

    /**
     * Shares minted to the first provider: floor(sqrt(amountA * amountB)).
     */
    public static BigInteger initialShares(final BigInteger amountA, final BigInteger amountB) {
        return isqrt(amountA.multiply(amountB));
    }

    /**
     * Shares minted for a ratio-matched deposit: floor(amountA * totalShares / reserveA).
     */
    public static BigInteger proportionalShares(final BigInteger amountA,
                                                final BigInteger reserveA,
                                                final BigInteger totalShares) {
        return amountA.multiply(totalShares).divide(reserveA);
    }

    /**
     * Portion of a reserve owed for burning {@code shares}: floor(shares * reserve / totalShares).
     */
    public static BigInteger proportionalAmount(final BigInteger shares,
                                                final BigInteger reserve,
                                                final BigInteger totalShares) {
        return shares.multiply(reserve).divide(totalShares);
    }

    /**
     * True when amountA / amountB equals reserveA / reserveB exactly.
     */
    public static boolean matchesRatio(final BigInteger amountA,
                                       final BigInteger amountB,
                                       final BigInteger reserveA,
                                       final BigInteger reserveB) {
        return amountA.multiply(reserveB).equals(amountB.multiply(reserveA));
    }

    /**
     * Constant product k = reserveA * reserveB.
     */
    public static BigInteger product(final BigInteger reserveA, final BigInteger reserveB) {
        return reserveA.multiply(reserveB);
    }

    /**
     * Floor of the square root.
     */
    public static BigInteger isqrt(final BigInteger value) {
        requireNonNegative(value, "value");
        return value.sqrt();
    }

    private static void requireNonNegative(final BigInteger value, final String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " cannot be negative, got: " + value);
        }
    }
}
