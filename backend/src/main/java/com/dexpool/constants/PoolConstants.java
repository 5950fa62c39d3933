// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.constants;

import java.math.BigInteger;

/**
 * Fixed parameters of the constant-product pool.
 *
 * The fee is not governable: every swap pays 0.3% of its input to the pool.
 */
public final class PoolConstants {

    private PoolConstants() {
        // Prevent instantiation
    }

    // ========================================
    // FEE STRUCTURE
    // ========================================

    /**
     * Swap fee in basis points (0.3% = 30 bps).
     */
    public static final long FEE_BPS = 30;

    /**
     * Input multiplier after the fee is taken (1000 - 3).
     */
    public static final BigInteger FEE_MULTIPLIER = BigInteger.valueOf(997);

    /**
     * Denominator the fee multiplier is expressed against.
     */
    public static final BigInteger FEE_DENOMINATOR = BigInteger.valueOf(1000);
}
