// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.config;

import com.dexpool.custody.InMemoryCustodyLedger;
import com.dexpool.engine.PoolEngine;
import com.dexpool.events.PoolEventHistory;
import com.dexpool.events.PoolEventSink;
import com.dexpool.metrics.PoolMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Wires the single pool engine of this application and its collaborators.
 *
 * Configuration:
 * - pool.asset-a / pool.asset-b (defaults: TKA / TKB)
 * - pool.custody.account (default: pool)
 * - pool.history.max-events (default: 1000)
 */
@Configuration
public class PoolConfig {

    private static final Logger logger = LoggerFactory.getLogger(PoolConfig.class);

    @Value("${pool.asset-a:TKA}")
    private String assetA;

    @Value("${pool.asset-b:TKB}")
    private String assetB;

    @Value("${pool.custody.account:pool}")
    private String poolAccount;

    @Value("${pool.history.max-events:1000}")
    private int maxEvents;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InMemoryCustodyLedger custodyLedger() {
        Set<String> assets = new LinkedHashSet<>(List.of(assetA, assetB));
        logger.info("Custody ledger for {} held by account '{}'", assets, poolAccount);
        return new InMemoryCustodyLedger(poolAccount, assets);
    }

    @Bean
    public PoolEventHistory poolEventHistory() {
        return new PoolEventHistory(maxEvents);
    }

    @Bean
    public PoolMetrics poolMetrics(MeterRegistry meterRegistry, ObjectProvider<PoolEngine> engine) {
        return new PoolMetrics(meterRegistry, assetA, assetB, () -> engine.getObject().getReserves());
    }

    @Bean
    public PoolEngine poolEngine(InMemoryCustodyLedger custodyLedger, List<PoolEventSink> sinks, Clock clock) {
        logger.info("Pool engine {}-{} with {} event sinks", assetA, assetB, sinks.size());
        return new PoolEngine(assetA, assetB, custodyLedger, sinks, clock);
    }
}
