// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.service;

import com.dexpool.common.DomainError;
import com.dexpool.common.Result;
import com.dexpool.custody.InMemoryCustodyLedger;
import com.dexpool.engine.PoolEngine;
import com.dexpool.events.PoolEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Seeds the pool at startup: mints the configured amounts to the bootstrap party and provides
 * them as the first liquidity.
 *
 * Configuration:
 * - pool.bootstrap.enabled=true/false (default: false)
 * - pool.bootstrap.party (default: bootstrap)
 * - pool.bootstrap.amount-a / pool.bootstrap.amount-b
 */
@Service
@ConditionalOnProperty(name = "pool.bootstrap.enabled", havingValue = "true", matchIfMissing = false)
public class PoolBootstrapService implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(PoolBootstrapService.class);

    private final PoolEngine engine;
    private final InMemoryCustodyLedger custody;

    @Value("${pool.bootstrap.party:bootstrap}")
    private String party;

    @Value("${pool.bootstrap.amount-a:1000000}")
    private BigInteger amountA;

    @Value("${pool.bootstrap.amount-b:1000000}")
    private BigInteger amountB;

    public PoolBootstrapService(PoolEngine engine, InMemoryCustodyLedger custody) {
        this.engine = engine;
        this.custody = custody;
    }

    @Override
    public void run(ApplicationArguments args) {
        bootstrap();
    }

    /**
     * Provide the initial liquidity unless the pool already has some.
     *
     * @return the receipt, or empty when the pool was already seeded
     * @throws IllegalStateException if the engine rejects the deposit
     */
    public Optional<PoolEvent.LiquidityAdded> bootstrap() {
        if (engine.totalShares().signum() > 0) {
            logger.info("Pool already has liquidity, skipping bootstrap");
            return Optional.empty();
        }
        logger.info("Bootstrapping pool {}-{} with {}/{} from {}",
            engine.assetA(), engine.assetB(), amountA, amountB, party);
        custody.mint(party, engine.assetA(), amountA);
        custody.mint(party, engine.assetB(), amountB);

        Result<PoolEvent.LiquidityAdded, DomainError> result = engine.provideLiquidity(party, amountA, amountB);
        PoolEvent.LiquidityAdded added = result.orElseThrow(
            error -> new IllegalStateException("Pool bootstrap failed: " + error));
        logger.info("Pool bootstrapped: {} shares minted to {}", added.sharesMinted(), party);
        return Optional.of(added);
    }
}
