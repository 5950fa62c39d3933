// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.metrics;

import com.dexpool.engine.Reserves;
import com.dexpool.events.PoolEvent;
import com.dexpool.events.PoolEventSink;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.math.BigInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Micrometer metrics for pool operations.
 *
 * Provides:
 * - Operation counters (liquidity added/removed, swaps by direction)
 * - Failure counters tagged by operation and error code
 * - Reserve, total share and k gauges (registered once, updated after each event)
 * - Swap amount distributions
 *
 * Gauges read a {@link Reserves} snapshot taken from the supplier after every committed operation.
 */
public class PoolMetrics implements PoolEventSink {

    private final MeterRegistry meterRegistry;
    private final String pair;
    private final Supplier<Reserves> reservesSupplier;

    private final Counter liquidityAdded;
    private final Counter liquidityRemoved;
    private final DistributionSummary swapInputAmounts;
    private final DistributionSummary swapOutputAmounts;

    private final AtomicReference<Reserves> lastReserves =
        new AtomicReference<>(new Reserves(BigInteger.ZERO, BigInteger.ZERO));

    public PoolMetrics(MeterRegistry meterRegistry, String assetA, String assetB, Supplier<Reserves> reservesSupplier) {
        this.meterRegistry = meterRegistry;
        this.pair = assetA + "-" + assetB;
        this.reservesSupplier = reservesSupplier;

        this.liquidityAdded = Counter.builder("dexpool.liquidity.added.total")
            .description("Committed liquidity provisions")
            .tag("pair", pair)
            .register(meterRegistry);

        this.liquidityRemoved = Counter.builder("dexpool.liquidity.removed.total")
            .description("Committed liquidity withdrawals")
            .tag("pair", pair)
            .register(meterRegistry);

        this.swapInputAmounts = DistributionSummary.builder("dexpool.swap.input.amount")
            .description("Distribution of swap input amounts")
            .baseUnit("units")
            .tag("pair", pair)
            .register(meterRegistry);

        this.swapOutputAmounts = DistributionSummary.builder("dexpool.swap.output.amount")
            .description("Distribution of swap output amounts")
            .baseUnit("units")
            .tag("pair", pair)
            .register(meterRegistry);

        Gauge.builder("dexpool.pool.reserve.amount", lastReserves, r -> r.get().reserveA().doubleValue())
            .tag("pair", pair)
            .tag("asset", assetA)
            .description("Pool reserve amount")
            .register(meterRegistry);

        Gauge.builder("dexpool.pool.reserve.amount", lastReserves, r -> r.get().reserveB().doubleValue())
            .tag("pair", pair)
            .tag("asset", assetB)
            .description("Pool reserve amount")
            .register(meterRegistry);

        Gauge.builder("dexpool.pool.k_invariant", lastReserves, r -> r.get().product().doubleValue())
            .tag("pair", pair)
            .description("Constant product k = reserveA * reserveB")
            .register(meterRegistry);
    }

    @Override
    public void publish(PoolEvent event) {
        if (event instanceof PoolEvent.LiquidityAdded) {
            liquidityAdded.increment();
        } else if (event instanceof PoolEvent.LiquidityRemoved) {
            liquidityRemoved.increment();
        } else if (event instanceof PoolEvent.Swap swap) {
            meterRegistry.counter("dexpool.swap.executed.total",
                "pair", pair,
                "direction", swap.direction().name()).increment();
            swapInputAmounts.record(swap.amountIn().doubleValue());
            swapOutputAmounts.record(swap.amountOut().doubleValue());
        }
        lastReserves.set(reservesSupplier.get());
    }

    /**
     * Record a rejected or failed operation. Error codes are a fixed set, so the tag stays bounded.
     */
    public void recordFailure(String operation, String errorCode) {
        meterRegistry.counter("dexpool.operation.failed.total",
            "pair", pair,
            "operation", operation,
            "code", errorCode == null ? "unknown" : errorCode).increment();
    }
}
