// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.events;

import com.dexpool.engine.SwapDirection;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Notifications emitted by the pool engine after a committed operation.
 *
 * Each one doubles as the receipt returned to the caller of that operation.
 * {@code sequence} increases by one per committed operation of a given engine.
 */
public sealed interface PoolEvent {

    long sequence();

    Instant occurredAt();

    /**
     * Party that initiated the operation.
     */
    String party();

    String type();

    record LiquidityAdded(long sequence,
                          Instant occurredAt,
                          String provider,
                          BigInteger amountA,
                          BigInteger amountB,
                          BigInteger sharesMinted) implements PoolEvent {
        @Override
        public String party() {
            return provider;
        }

        @Override
        public String type() {
            return "LIQUIDITY_ADDED";
        }
    }

    record LiquidityRemoved(long sequence,
                            Instant occurredAt,
                            String provider,
                            BigInteger sharesBurned,
                            BigInteger amountA,
                            BigInteger amountB) implements PoolEvent {
        @Override
        public String party() {
            return provider;
        }

        @Override
        public String type() {
            return "LIQUIDITY_REMOVED";
        }
    }

    record Swap(long sequence,
                Instant occurredAt,
                String caller,
                SwapDirection direction,
                BigInteger amountIn,
                BigInteger amountOut) implements PoolEvent {
        @Override
        public String party() {
            return caller;
        }

        @Override
        public String type() {
            return "SWAP";
        }
    }
}
