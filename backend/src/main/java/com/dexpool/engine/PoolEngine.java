// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.engine;

import com.dexpool.common.DomainError;
import com.dexpool.common.Result;
import com.dexpool.common.errors.CustodyTransferFailedError;
import com.dexpool.common.errors.InsufficientInitialLiquidityError;
import com.dexpool.common.errors.InsufficientLiquidityMintedError;
import com.dexpool.common.errors.InsufficientOutputError;
import com.dexpool.common.errors.InsufficientSharesError;
import com.dexpool.common.errors.InvariantViolationError;
import com.dexpool.common.errors.NoLiquidityError;
import com.dexpool.common.errors.RatioMismatchError;
import com.dexpool.common.errors.ValidationError;
import com.dexpool.common.errors.ZeroAmountError;
import com.dexpool.common.errors.ZeroSwapAmountError;
import com.dexpool.custody.CustodyGateway;
import com.dexpool.events.PoolEvent;
import com.dexpool.events.PoolEventSink;
import com.dexpool.util.AmmMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Constant-product pool over two assets, with a share ledger for liquidity providers.
 *
 * Every mutation runs under one lock and follows the same steps: validate, commit the new state,
 * run the custody transfers, then notify. If a transfer fails the state is restored and the
 * transfers already made are reversed before the lock is released, so no caller ever observes a
 * half-applied operation. Reads take the same lock.
 *
 * All arithmetic is on {@link BigInteger} with floor division.
 */
public class PoolEngine {

    private static final Logger logger = LoggerFactory.getLogger(PoolEngine.class);

    private final String assetA;
    private final String assetB;
    private final CustodyGateway custody;
    private final List<PoolEventSink> sinks;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final ShareLedger ledger = new ShareLedger();
    private PoolState state = PoolState.EMPTY;
    private long sequence;

    public PoolEngine(final String assetA,
                      final String assetB,
                      final CustodyGateway custody,
                      final List<PoolEventSink> sinks,
                      final Clock clock) {
        if (assetA == null || assetA.isBlank() || assetB == null || assetB.isBlank()) {
            throw new IllegalArgumentException("Both asset identifiers are required");
        }
        if (assetA.equals(assetB)) {
            throw new IllegalArgumentException("Pool assets must differ, both are: " + assetA);
        }
        this.assetA = assetA;
        this.assetB = assetB;
        this.custody = Objects.requireNonNull(custody, "custody");
        this.sinks = List.copyOf(Objects.requireNonNull(sinks, "sinks"));
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String assetA() {
        return assetA;
    }

    public String assetB() {
        return assetB;
    }

    // ========================================
    // LIQUIDITY
    // ========================================

    /**
     * Deposit both assets and mint shares to {@code provider}.
     *
     * The first deposit sets the price and mints floor(sqrt(amountA * amountB)) shares. Later
     * deposits must match the reserve ratio exactly and mint floor(amountA * totalShares / reserveA).
     */
    public Result<PoolEvent.LiquidityAdded, DomainError> provideLiquidity(final String provider,
                                                                          final BigInteger amountA,
                                                                          final BigInteger amountB) {
        Optional<DomainError> invalid = checkParty(provider, "provider")
                .or(() -> checkAmount(amountA, "amountA"))
                .or(() -> checkAmount(amountB, "amountB"));
        if (invalid.isPresent()) {
            return reject("provideLiquidity", invalid.get());
        }
        if (amountA.signum() == 0 || amountB.signum() == 0) {
            return reject("provideLiquidity", new ZeroAmountError(
                    "Both amounts must be positive, got amountA=" + amountA + ", amountB=" + amountB));
        }

        lock.lock();
        try {
            PoolState current = state;
            BigInteger minted;
            if (!current.hasLiquidity()) {
                minted = AmmMath.initialShares(amountA, amountB);
                if (minted.signum() == 0) {
                    return reject("provideLiquidity", new InsufficientInitialLiquidityError(
                            "Initial deposit " + amountA + "/" + amountB + " mints zero shares"));
                }
            } else {
                if (!AmmMath.matchesRatio(amountA, amountB, current.reserveA(), current.reserveB())) {
                    return reject("provideLiquidity", new RatioMismatchError(
                            "Deposit " + amountA + "/" + amountB + " does not match reserve ratio "
                                    + current.reserveA() + "/" + current.reserveB()));
                }
                minted = AmmMath.proportionalShares(amountA, current.reserveA(), current.totalShares());
                if (minted.signum() == 0) {
                    return reject("provideLiquidity", new InsufficientLiquidityMintedError(
                            "Deposit " + amountA + "/" + amountB + " is too small to mint a share"));
                }
            }

            PoolState next = new PoolState(
                    current.reserveA().add(amountA),
                    current.reserveB().add(amountB),
                    current.totalShares().add(minted));
            BigInteger previousShares = ledger.sharesOf(provider);
            state = next;
            ledger.credit(provider, minted);

            TransferPlan plan = new TransferPlan()
                    .pull(provider, assetA, amountA)
                    .pull(provider, assetB, amountB);
            Optional<CustodyTransferFailedError> failure = plan.execute(custody);
            if (failure.isPresent()) {
                state = current;
                ledger.set(provider, previousShares);
                return reject("provideLiquidity", failure.get());
            }

            PoolEvent.LiquidityAdded event = new PoolEvent.LiquidityAdded(
                    ++sequence, clock.instant(), provider, amountA, amountB, minted);
            logger.info("Liquidity added by {}: {} {} + {} {} -> {} shares (total {})",
                    provider, amountA, assetA, amountB, assetB, minted, next.totalShares());
            publish(event);
            return Result.ok(event);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Burn {@code shareAmount} of the provider's shares and return the proportional reserves.
     *
     * A leg that floors to zero is paid out as zero; burning every share empties the pool.
     */
    public Result<PoolEvent.LiquidityRemoved, DomainError> removeLiquidity(final String provider,
                                                                           final BigInteger shareAmount) {
        Optional<DomainError> invalid = checkParty(provider, "provider")
                .or(() -> checkAmount(shareAmount, "shareAmount"));
        if (invalid.isPresent()) {
            return reject("removeLiquidity", invalid.get());
        }
        if (shareAmount.signum() == 0) {
            return reject("removeLiquidity", new ZeroAmountError("shareAmount must be positive"));
        }

        lock.lock();
        try {
            BigInteger held = ledger.sharesOf(provider);
            if (shareAmount.compareTo(held) > 0) {
                return reject("removeLiquidity", new InsufficientSharesError(shareAmount, held));
            }

            PoolState current = state;
            BigInteger amountA = AmmMath.proportionalAmount(shareAmount, current.reserveA(), current.totalShares());
            BigInteger amountB = AmmMath.proportionalAmount(shareAmount, current.reserveB(), current.totalShares());

            PoolState next = new PoolState(
                    current.reserveA().subtract(amountA),
                    current.reserveB().subtract(amountB),
                    current.totalShares().subtract(shareAmount));
            state = next;
            ledger.debit(provider, shareAmount);

            TransferPlan plan = new TransferPlan()
                    .push(provider, assetA, amountA)
                    .push(provider, assetB, amountB);
            Optional<CustodyTransferFailedError> failure = plan.execute(custody);
            if (failure.isPresent()) {
                state = current;
                ledger.set(provider, held);
                return reject("removeLiquidity", failure.get());
            }

            PoolEvent.LiquidityRemoved event = new PoolEvent.LiquidityRemoved(
                    ++sequence, clock.instant(), provider, shareAmount, amountA, amountB);
            logger.info("Liquidity removed by {}: {} shares -> {} {} + {} {} (total {})",
                    provider, shareAmount, amountA, assetA, amountB, assetB, next.totalShares());
            publish(event);
            return Result.ok(event);
        } finally {
            lock.unlock();
        }
    }

    // ========================================
    // SWAPS
    // ========================================

    public Result<PoolEvent.Swap, DomainError> swapAForB(final String trader, final BigInteger amountIn) {
        return swap(trader, SwapDirection.A_TO_B, amountIn);
    }

    public Result<PoolEvent.Swap, DomainError> swapBForA(final String trader, final BigInteger amountIn) {
        return swap(trader, SwapDirection.B_TO_A, amountIn);
    }

    /**
     * Sell {@code amountIn} of the input asset for the quoted amount of the other one.
     */
    public Result<PoolEvent.Swap, DomainError> swap(final String trader,
                                                    final SwapDirection direction,
                                                    final BigInteger amountIn) {
        Optional<DomainError> invalid = checkParty(trader, "trader")
                .or(() -> direction == null
                        ? Optional.<DomainError>of(new ValidationError("direction is required"))
                        : Optional.<DomainError>empty())
                .or(() -> checkAmount(amountIn, "amountIn"));
        if (invalid.isPresent()) {
            return reject("swap", invalid.get());
        }
        if (amountIn.signum() == 0) {
            return reject("swap", new ZeroSwapAmountError("amountIn must be positive"));
        }

        lock.lock();
        try {
            PoolState current = state;
            if (!current.hasLiquidity()) {
                return reject("swap", new NoLiquidityError("Pool has no liquidity"));
            }
            Reserves reserves = current.reserves();
            BigInteger reserveIn = reserves.in(direction);
            BigInteger reserveOut = reserves.out(direction);
            BigInteger amountOut = AmmMath.quoteOut(amountIn, reserveIn, reserveOut);
            if (amountOut.signum() == 0) {
                return reject("swap", new InsufficientOutputError(
                        "Swapping " + amountIn + " against reserves " + reserveIn + "/" + reserveOut + " yields nothing"));
            }
            if (amountOut.compareTo(reserveOut) >= 0) {
                return reject("swap", new InsufficientOutputError(
                        "Output " + amountOut + " would exhaust reserve " + reserveOut));
            }

            PoolState next = current.afterSwap(direction, amountIn, amountOut);
            BigInteger kBefore = reserves.product();
            BigInteger kAfter = next.reserves().product();
            if (kAfter.compareTo(kBefore) < 0) {
                logger.error("Swap would decrease k from {} to {}; refusing", kBefore, kAfter);
                return reject("swap", new InvariantViolationError(
                        "Constant product would decrease from " + kBefore + " to " + kAfter));
            }
            state = next;

            String assetIn = direction.isAToB() ? assetA : assetB;
            String assetOut = direction.isAToB() ? assetB : assetA;
            TransferPlan plan = new TransferPlan()
                    .pull(trader, assetIn, amountIn)
                    .push(trader, assetOut, amountOut);
            Optional<CustodyTransferFailedError> failure = plan.execute(custody);
            if (failure.isPresent()) {
                state = current;
                return reject("swap", failure.get());
            }

            PoolEvent.Swap event = new PoolEvent.Swap(
                    ++sequence, clock.instant(), trader, direction, amountIn, amountOut);
            logger.info("Swap by {}: {} {} -> {} {} (k {} -> {})",
                    trader, amountIn, assetIn, amountOut, assetOut, kBefore, kAfter);
            publish(event);
            return Result.ok(event);
        } finally {
            lock.unlock();
        }
    }

    // ========================================
    // QUERIES
    // ========================================

    public Reserves getReserves() {
        lock.lock();
        try {
            return state.reserves();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Spot price of A in units of B, floor(reserveB / reserveA).
     */
    public Result<BigInteger, DomainError> getPrice() {
        lock.lock();
        try {
            if (state.reserveA().signum() == 0) {
                return Result.err(new NoLiquidityError("Pool has no liquidity"));
            }
            return Result.ok(state.reserveB().divide(state.reserveA()));
        } finally {
            lock.unlock();
        }
    }

    public BigInteger shareOf(final String provider) {
        lock.lock();
        try {
            return ledger.sharesOf(provider);
        } finally {
            lock.unlock();
        }
    }

    public BigInteger totalShares() {
        lock.lock();
        try {
            return state.totalShares();
        } finally {
            lock.unlock();
        }
    }

    public PoolState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Every provider with a non-zero balance, sorted by provider.
     */
    public Map<String, BigInteger> shareholders() {
        lock.lock();
        try {
            return ledger.snapshot();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Output the pool would pay right now for {@code amountIn} in {@code direction}. Does not mutate.
     */
    public Result<BigInteger, DomainError> quote(final SwapDirection direction, final BigInteger amountIn) {
        Optional<DomainError> invalid = direction == null
                ? Optional.<DomainError>of(new ValidationError("direction is required"))
                : checkAmount(amountIn, "amountIn");
        if (invalid.isPresent()) {
            return Result.err(invalid.get());
        }
        if (amountIn.signum() == 0) {
            return Result.err(new ZeroSwapAmountError("amountIn must be positive"));
        }
        Reserves reserves = getReserves();
        if (reserves.reserveA().signum() == 0) {
            return Result.err(new NoLiquidityError("Pool has no liquidity"));
        }
        return Result.ok(AmmMath.quoteOut(amountIn, reserves.in(direction), reserves.out(direction)));
    }

    /**
     * Pure fee-inclusive quote against arbitrary reserves; see {@link AmmMath#quoteOut}.
     */
    public static BigInteger quoteOut(final BigInteger amountIn,
                                      final BigInteger reserveIn,
                                      final BigInteger reserveOut) {
        return AmmMath.quoteOut(amountIn, reserveIn, reserveOut);
    }

    // ========================================
    // INTERNALS
    // ========================================

    private void publish(final PoolEvent event) {
        for (PoolEventSink sink : sinks) {
            try {
                sink.publish(event);
            } catch (RuntimeException e) {
                logger.warn("Event sink {} failed on #{} {}: {}",
                        sink.getClass().getSimpleName(), event.sequence(), event.type(), e.getMessage(), e);
            }
        }
    }

    private static <T> Result<T, DomainError> reject(final String operation, final DomainError error) {
        logger.debug("{} rejected: {}", operation, error);
        return Result.err(error);
    }

    private Optional<DomainError> checkParty(final String party, final String name) {
        if (party == null || party.isBlank()) {
            return Optional.of(new ValidationError(name + " is required"));
        }
        if (custody.isPoolAccount(party)) {
            return Optional.of(new ValidationError(name + " '" + party + "' is the pool custody account"));
        }
        return Optional.empty();
    }

    private static Optional<DomainError> checkAmount(final BigInteger amount, final String name) {
        if (amount == null) {
            return Optional.of(new ValidationError(name + " is required"));
        }
        if (amount.signum() < 0) {
            return Optional.of(new ValidationError(name + " cannot be negative, got: " + amount));
        }
        return Optional.empty();
    }
}
