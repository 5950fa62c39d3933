// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingPoolEventSink implements PoolEventSink {

    private static final Logger logger = LoggerFactory.getLogger(LoggingPoolEventSink.class);

    @Override
    public void publish(final PoolEvent event) {
        if (event instanceof PoolEvent.LiquidityAdded added) {
            logger.info("[#{}] LiquidityAdded provider={} amountA={} amountB={} sharesMinted={}",
                added.sequence(), added.provider(), added.amountA(), added.amountB(), added.sharesMinted());
        } else if (event instanceof PoolEvent.LiquidityRemoved removed) {
            logger.info("[#{}] LiquidityRemoved provider={} sharesBurned={} amountA={} amountB={}",
                removed.sequence(), removed.provider(), removed.sharesBurned(), removed.amountA(), removed.amountB());
        } else if (event instanceof PoolEvent.Swap swap) {
            logger.info("[#{}] Swap caller={} direction={} amountIn={} amountOut={}",
                swap.sequence(), swap.caller(), swap.direction(), swap.amountIn(), swap.amountOut());
        }
    }
}
