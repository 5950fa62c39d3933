// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

import com.dexpool.events.PoolEvent;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON view of a pool notification. Only the fields of the event's own type are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PoolEventResponse {
    public long sequence;
    public String type;
    public String party;
    public String occurredAt;

    // LIQUIDITY_ADDED / LIQUIDITY_REMOVED
    public String amountA;
    public String amountB;
    public String sharesMinted;
    public String sharesBurned;

    // SWAP
    public String direction;
    public String amountIn;
    public String amountOut;

    public PoolEventResponse() {}

    public static PoolEventResponse from(PoolEvent event) {
        PoolEventResponse response = new PoolEventResponse();
        response.sequence = event.sequence();
        response.type = event.type();
        response.party = event.party();
        response.occurredAt = event.occurredAt().toString();
        if (event instanceof PoolEvent.LiquidityAdded added) {
            response.amountA = added.amountA().toString();
            response.amountB = added.amountB().toString();
            response.sharesMinted = added.sharesMinted().toString();
        } else if (event instanceof PoolEvent.LiquidityRemoved removed) {
            response.amountA = removed.amountA().toString();
            response.amountB = removed.amountB().toString();
            response.sharesBurned = removed.sharesBurned().toString();
        } else if (event instanceof PoolEvent.Swap swap) {
            response.direction = swap.direction().name();
            response.amountIn = swap.amountIn().toString();
            response.amountOut = swap.amountOut().toString();
        }
        return response;
    }
}
