// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.service;

import com.dexpool.common.DomainError;
import com.dexpool.common.Result;
import com.dexpool.common.errors.ValidationError;
import com.dexpool.engine.PoolEngine;
import com.dexpool.engine.PoolState;
import com.dexpool.engine.Reserves;
import com.dexpool.engine.SwapDirection;
import com.dexpool.events.PoolEvent;
import com.dexpool.events.PoolEventHistory;
import com.dexpool.metrics.PoolMetrics;
import io.opentelemetry.instrumentation.annotations.SpanAttribute;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;

/**
 * Entry point for the REST layer: delegates to the single {@link PoolEngine} and records
 * failures in {@link PoolMetrics}.
 */
@Service
public class PoolService {

    private static final Logger LOG = LoggerFactory.getLogger(PoolService.class);
    private static final int MAX_EVENT_PAGE = 500;

    private final PoolEngine engine;
    private final PoolEventHistory history;
    private final PoolMetrics metrics;

    public PoolService(PoolEngine engine, PoolEventHistory history, PoolMetrics metrics) {
        this.engine = engine;
        this.history = history;
        this.metrics = metrics;
    }

    @WithSpan
    public Result<PoolEvent.LiquidityAdded, DomainError> addLiquidity(
            @SpanAttribute("party") String provider, BigInteger amountA, BigInteger amountB) {
        return track("add_liquidity", engine.provideLiquidity(provider, amountA, amountB));
    }

    @WithSpan
    public Result<PoolEvent.LiquidityRemoved, DomainError> removeLiquidity(
            @SpanAttribute("party") String provider, BigInteger shares) {
        return track("remove_liquidity", engine.removeLiquidity(provider, shares));
    }

    @WithSpan
    public Result<PoolEvent.Swap, DomainError> swap(
            @SpanAttribute("party") String trader, SwapDirection direction, BigInteger amountIn) {
        return track("swap", engine.swap(trader, direction, amountIn));
    }

    public Reserves reserves() {
        return engine.getReserves();
    }

    public PoolState state() {
        return engine.state();
    }

    public Result<BigInteger, DomainError> price() {
        return engine.getPrice();
    }

    public BigInteger sharesOf(String provider) {
        return engine.shareOf(provider);
    }

    public BigInteger totalShares() {
        return engine.totalShares();
    }

    /**
     * Pure quote against caller-supplied reserves.
     */
    public Result<BigInteger, DomainError> quote(BigInteger amountIn, BigInteger reserveIn, BigInteger reserveOut) {
        try {
            return Result.ok(PoolEngine.quoteOut(amountIn, reserveIn, reserveOut));
        } catch (IllegalArgumentException e) {
            return Result.err(new ValidationError(e.getMessage()));
        }
    }

    /**
     * Quote against the pool's current reserves.
     */
    public Result<BigInteger, DomainError> quote(SwapDirection direction, BigInteger amountIn) {
        return engine.quote(direction, amountIn);
    }

    public List<PoolEvent> recentEvents(int limit) {
        int capped = Math.max(1, Math.min(limit, MAX_EVENT_PAGE));
        return history.recent(capped);
    }

    public String assetA() {
        return engine.assetA();
    }

    public String assetB() {
        return engine.assetB();
    }

    private <T> Result<T, DomainError> track(String operation, Result<T, DomainError> result) {
        return result.peekError(error -> {
            metrics.recordFailure(operation, error.code());
            LOG.warn("{} failed: {}", operation, error);
        });
    }
}
