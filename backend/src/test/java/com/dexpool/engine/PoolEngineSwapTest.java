// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.engine;

import com.dexpool.common.DomainError;
import com.dexpool.common.Result;
import com.dexpool.common.errors.InsufficientOutputError;
import com.dexpool.common.errors.NoLiquidityError;
import com.dexpool.common.errors.ValidationError;
import com.dexpool.common.errors.ZeroSwapAmountError;
import com.dexpool.custody.InMemoryCustodyLedger;
import com.dexpool.events.PoolEvent;
import com.dexpool.events.PoolEventHistory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class PoolEngineSwapTest {

    private InMemoryCustodyLedger custody;
    private PoolEventHistory history;
    private PoolEngine engine;

    @BeforeEach
    void setUp() {
        custody = new InMemoryCustodyLedger("pool", Set.of("TKA", "TKB"));
        history = new PoolEventHistory(100);
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T12:00:00Z"), ZoneId.of("UTC"));
        engine = new PoolEngine("TKA", "TKB", custody, List.of(history), clock);
        for (String party : List.of("alice", "bob", "trader")) {
            custody.mint(party, "TKA", big(1_000_000));
            custody.mint(party, "TKB", big(1_000_000));
        }
    }

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    private void seed(long amountA, long amountB) {
        assertThat(engine.provideLiquidity("alice", big(amountA), big(amountB)).isOk()).isTrue();
    }

    @Test
    @DisplayName("Selling 10 A into 100/200 pays 18 B, below the fee-free 18.18")
    void testSwapAForB() {
        seed(100, 200);

        Result<PoolEvent.Swap, DomainError> result = engine.swapAForB("trader", big(10));

        assertThat(result.isOk()).isTrue();
        PoolEvent.Swap swap = result.getValueUnsafe();
        assertThat(swap.amountOut()).isEqualTo(big(18));
        assertThat(swap.direction()).isEqualTo(SwapDirection.A_TO_B);
        assertThat(swap.caller()).isEqualTo("trader");
        assertThat(engine.getReserves()).isEqualTo(new Reserves(big(110), big(182)));
        assertThat(engine.getPrice().getValueUnsafe()).isEqualTo(BigInteger.ONE);
        assertThat(custody.balanceOf("trader", "TKA")).isEqualTo(big(999_990));
        assertThat(custody.balanceOf("trader", "TKB")).isEqualTo(big(1_000_018));
    }

    @Test
    void testSwapBForA() {
        seed(100, 200);

        Result<PoolEvent.Swap, DomainError> result = engine.swapBForA("trader", big(10));

        assertThat(result.isOk()).isTrue();
        assertThat(result.getValueUnsafe().amountOut()).isEqualTo(big(4));
        assertThat(engine.getReserves()).isEqualTo(new Reserves(big(96), big(210)));
        assertThat(custody.balanceOf("pool", "TKA")).isEqualTo(big(96));
        assertThat(custody.balanceOf("pool", "TKB")).isEqualTo(big(210));
    }

    @Test
    void testLargeSwap_hasPriceImpact() {
        seed(100, 200);

        Result<PoolEvent.Swap, DomainError> result = engine.swapAForB("trader", big(80));

        assertThat(result.getValueUnsafe().amountOut()).isEqualTo(big(88));
        assertThat(engine.getReserves()).isEqualTo(new Reserves(big(180), big(112)));
    }

    @Test
    void testSwap_matchesQuote() {
        seed(1_000, 3_000);
        BigInteger quoted = engine.quote(SwapDirection.B_TO_A, big(250)).getValueUnsafe();

        Result<PoolEvent.Swap, DomainError> result = engine.swapBForA("trader", big(250));

        assertThat(result.getValueUnsafe().amountOut()).isEqualTo(quoted);
        assertThat(quoted).isEqualTo(PoolEngine.quoteOut(big(250), big(3_000), big(1_000)));
    }

    @Test
    void testSwap_kNeverDecreases() {
        seed(100, 200);
        BigInteger kBefore = engine.getReserves().product();

        engine.swapAForB("trader", big(10));
        BigInteger kMiddle = engine.getReserves().product();
        engine.swapBForA("trader", big(18));
        BigInteger kAfter = engine.getReserves().product();

        assertThat(kMiddle).isGreaterThanOrEqualTo(kBefore);
        assertThat(kAfter).isGreaterThanOrEqualTo(kMiddle);
    }

    @Test
    void testSwap_doesNotChangeShares() {
        seed(100, 200);

        engine.swapAForB("trader", big(10));

        assertThat(engine.totalShares()).isEqualTo(big(141));
        assertThat(engine.shareOf("trader")).isZero();
    }

    @Test
    void testSwapOnEmptyPool_noLiquidity() {
        Result<PoolEvent.Swap, DomainError> result = engine.swapAForB("trader", big(10));

        assertThat(result.getErrorUnsafe()).isInstanceOf(NoLiquidityError.class);
        assertThat(engine.getPrice().getErrorUnsafe()).isInstanceOf(NoLiquidityError.class);
        assertThat(engine.quote(SwapDirection.A_TO_B, big(10)).getErrorUnsafe()).isInstanceOf(NoLiquidityError.class);
        assertThat(custody.balanceOf("trader", "TKA")).isEqualTo(big(1_000_000));
    }

    @Test
    void testZeroSwap_rejected() {
        seed(100, 200);

        Result<PoolEvent.Swap, DomainError> result = engine.swapBForA("trader", BigInteger.ZERO);

        assertThat(result.getErrorUnsafe()).isInstanceOf(ZeroSwapAmountError.class);
        assertThat(result.getErrorUnsafe().code()).isEqualTo("ZERO_SWAP_AMOUNT");
    }

    @Test
    void testZeroSwapAForB_leavesPoolCustodyAndHistoryUntouched() {
        seed(100, 200);
        PoolState before = engine.state();
        int eventsBefore = history.size();

        Result<PoolEvent.Swap, DomainError> result = engine.swapAForB("trader", BigInteger.ZERO);

        assertThat(result.getErrorUnsafe()).isInstanceOf(ZeroSwapAmountError.class);
        assertThat(engine.state()).isEqualTo(before);
        assertThat(history.size()).isEqualTo(eventsBefore);
        assertThat(custody.balanceOf("pool", "TKA")).isEqualTo(big(100));
        assertThat(custody.balanceOf("pool", "TKB")).isEqualTo(big(200));
        assertThat(custody.balanceOf("trader", "TKA")).isEqualTo(big(1_000_000));
        assertThat(custody.balanceOf("trader", "TKB")).isEqualTo(big(1_000_000));
    }

    @Test
    @DisplayName("The custody pool account cannot trade against its own pool")
    void testPoolAccountAsTrader_rejectedAndProvidersCanStillExit() {
        engine.provideLiquidity("alice", big(1_000), big(2_000));
        PoolState before = engine.state();

        Result<PoolEvent.Swap, DomainError> result = engine.swapAForB("pool", big(500));

        assertThat(result.getErrorUnsafe()).isInstanceOf(ValidationError.class);
        assertThat(engine.state()).isEqualTo(before);
        assertThat(history.size()).isEqualTo(1);

        Result<PoolEvent.LiquidityRemoved, DomainError> exit = engine.removeLiquidity("alice", engine.shareOf("alice"));

        assertThat(exit.isOk()).isTrue();
        assertThat(exit.getValueUnsafe().amountA()).isEqualTo(big(1_000));
        assertThat(exit.getValueUnsafe().amountB()).isEqualTo(big(2_000));
        assertThat(custody.balanceOf("pool", "TKA")).isZero();
    }

    @Test
    void testZeroSwapOnEmptyPool_reportsZeroAmountFirst() {
        Result<PoolEvent.Swap, DomainError> result = engine.swapAForB("trader", BigInteger.ZERO);

        assertThat(result.getErrorUnsafe()).isInstanceOf(ZeroSwapAmountError.class);
    }

    @Test
    void testDustSwap_insufficientOutput() {
        seed(1_000_000, 1_000_000);
        PoolState before = engine.state();

        Result<PoolEvent.Swap, DomainError> result = engine.swapAForB("trader", BigInteger.ONE);

        assertThat(result.getErrorUnsafe()).isInstanceOf(InsufficientOutputError.class);
        assertThat(engine.state()).isEqualTo(before);
        assertThat(custody.balanceOf("trader", "TKA")).isEqualTo(big(1_000_000));
    }

    @Test
    void testMissingDirectionOrNegativeInput_validationError() {
        seed(100, 200);

        assertThat(engine.swap("trader", null, big(10)).getErrorUnsafe()).isInstanceOf(ValidationError.class);
        assertThat(engine.swap("trader", SwapDirection.A_TO_B, big(-5)).getErrorUnsafe())
            .isInstanceOf(ValidationError.class);
        assertThat(engine.swap(null, SwapDirection.A_TO_B, big(5)).getErrorUnsafe())
            .isInstanceOf(ValidationError.class);
    }

    @Test
    void testTraderWithoutFunds_failsAndPoolUnchanged() {
        seed(100, 200);
        PoolState before = engine.state();

        Result<PoolEvent.Swap, DomainError> result = engine.swapAForB("stranger", big(10));

        assertThat(result.isErr()).isTrue();
        assertThat(result.getErrorUnsafe().code()).isEqualTo("CUSTODY_TRANSFER_FAILED");
        assertThat(engine.state()).isEqualTo(before);
        assertThat(custody.balanceOf("pool", "TKA")).isEqualTo(big(100));
        assertThat(custody.balanceOf("pool", "TKB")).isEqualTo(big(200));
    }

    @Test
    @DisplayName("Fees stay in the pool and accrue to every share holder")
    void testFeesAccrueToProviders() {
        seed(100, 200);
        engine.provideLiquidity("bob", big(50), big(100));
        engine.swapAForB("trader", big(10));
        assertThat(engine.getReserves()).isEqualTo(new Reserves(big(160), big(282)));

        PoolEvent.LiquidityRemoved bob = engine.removeLiquidity("bob", big(70)).getValueUnsafe();
        PoolEvent.LiquidityRemoved alice = engine.removeLiquidity("alice", big(141)).getValueUnsafe();

        assertThat(bob.amountA()).isEqualTo(big(53));
        assertThat(bob.amountB()).isEqualTo(big(93));
        assertThat(alice.amountA()).isEqualTo(big(107));
        assertThat(alice.amountB()).isEqualTo(big(189));
        assertThat(engine.state()).isEqualTo(PoolState.EMPTY);
        assertThat(custody.balanceOf("pool", "TKA")).isZero();
        assertThat(custody.balanceOf("pool", "TKB")).isZero();
    }

    @Test
    void testSwapEvent_recorded() {
        seed(100, 200);

        engine.swapAForB("trader", big(10));

        assertThat(history.recent(1)).singleElement()
            .isInstanceOfSatisfying(PoolEvent.Swap.class, swap -> {
                assertThat(swap.type()).isEqualTo("SWAP");
                assertThat(swap.amountIn()).isEqualTo(big(10));
                assertThat(swap.sequence()).isEqualTo(2);
            });
    }
}
