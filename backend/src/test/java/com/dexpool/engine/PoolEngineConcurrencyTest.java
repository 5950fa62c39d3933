// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.engine;

import com.dexpool.custody.InMemoryCustodyLedger;
import com.dexpool.events.PoolEvent;
import com.dexpool.events.PoolEventHistory;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class PoolEngineConcurrencyTest {

    private static final int THREADS = 8;
    private static final int OPS_PER_THREAD = 200;

    @Test
    void testConcurrentOperations_areSerialized() throws Exception {
        InMemoryCustodyLedger custody = new InMemoryCustodyLedger("pool", Set.of("TKA", "TKB"));
        PoolEventHistory history = new PoolEventHistory(THREADS * OPS_PER_THREAD + 1);
        PoolEngine engine = new PoolEngine("TKA", "TKB", custody, List.of(history), Clock.systemUTC());

        custody.mint("lp", "TKA", BigInteger.valueOf(1_000_000));
        custody.mint("lp", "TKB", BigInteger.valueOf(1_000_000));
        engine.provideLiquidity("lp", BigInteger.valueOf(1_000_000), BigInteger.valueOf(1_000_000));
        for (int t = 0; t < THREADS; t++) {
            custody.mint("trader-" + t, "TKA", BigInteger.valueOf(10_000_000));
            custody.mint("trader-" + t, "TKB", BigInteger.valueOf(10_000_000));
        }

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Integer>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < THREADS; t++) {
                String trader = "trader-" + t;
                boolean aToB = t % 2 == 0;
                futures.add(executor.submit(() -> {
                    start.await();
                    int committed = 0;
                    for (int i = 0; i < OPS_PER_THREAD; i++) {
                        BigInteger amount = BigInteger.valueOf(100 + i);
                        boolean ok = aToB
                            ? engine.swapAForB(trader, amount).isOk()
                            : engine.swapBForA(trader, amount).isOk();
                        if (ok) {
                            committed++;
                        }
                        assertThat(engine.getReserves().product())
                            .isGreaterThanOrEqualTo(BigInteger.valueOf(1_000_000).pow(2));
                    }
                    return committed;
                }));
            }
            start.countDown();

            int committed = 0;
            for (Future<Integer> future : futures) {
                committed += future.get(30, TimeUnit.SECONDS);
            }

            assertThat(committed).isEqualTo(THREADS * OPS_PER_THREAD);
            assertThat(history.size()).isEqualTo(committed + 1);
            List<Long> sequences = history.recent(committed + 1).stream()
                .map(PoolEvent::sequence)
                .sorted()
                .collect(Collectors.toList());
            assertThat(sequences).doesNotHaveDuplicates();
            assertThat(sequences.get(0)).isEqualTo(1L);
            assertThat(sequences.get(sequences.size() - 1)).isEqualTo((long) committed + 1);

            Reserves reserves = engine.getReserves();
            assertThat(custody.balanceOf("pool", "TKA")).isEqualTo(reserves.reserveA());
            assertThat(custody.balanceOf("pool", "TKB")).isEqualTo(reserves.reserveB());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testConcurrentProviders_sharesAddUp() throws Exception {
        InMemoryCustodyLedger custody = new InMemoryCustodyLedger("pool", Set.of("TKA", "TKB"));
        PoolEngine engine = new PoolEngine("TKA", "TKB", custody, List.of(), Clock.systemUTC());
        custody.mint("seed", "TKA", BigInteger.valueOf(1_000));
        custody.mint("seed", "TKB", BigInteger.valueOf(2_000));
        engine.provideLiquidity("seed", BigInteger.valueOf(1_000), BigInteger.valueOf(2_000));

        ExecutorService executor = Executors.newFixedThreadPool(THREADS);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < THREADS; t++) {
                String provider = "lp-" + t;
                custody.mint(provider, "TKA", BigInteger.valueOf(1_000));
                custody.mint(provider, "TKB", BigInteger.valueOf(2_000));
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 10; i++) {
                        assertThat(engine.provideLiquidity(provider, BigInteger.valueOf(100), BigInteger.valueOf(200))
                            .isOk()).isTrue();
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        BigInteger sum = engine.shareholders().values().stream().reduce(BigInteger.ZERO, BigInteger::add);
        assertThat(engine.totalShares()).isEqualTo(sum);
        assertThat(engine.getReserves()).isEqualTo(
            new Reserves(BigInteger.valueOf(1_000 + THREADS * 1_000), BigInteger.valueOf(2_000 + THREADS * 2_000)));
    }
}
