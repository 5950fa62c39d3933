// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.custody;

import java.math.BigInteger;

/**
 * Moves assets between a holder and the pool.
 *
 * Each call is atomic: it either moves the full amount and returns true, or moves nothing and
 * returns false. A runtime exception is treated the same as a false return.
 */
public interface CustodyGateway {

    /**
     * Move {@code amount} of {@code asset} from {@code holder} into the pool.
     */
    boolean pullFrom(String holder, String asset, BigInteger amount);

    /**
     * Move {@code amount} of {@code asset} from the pool to {@code holder}.
     */
    boolean pushTo(String holder, String asset, BigInteger amount);

    /**
     * True if {@code party} names the account that holds the pooled assets. Such a party can
     * never trade or provide liquidity, since its transfers would move nothing.
     */
    boolean isPoolAccount(String party);
}
