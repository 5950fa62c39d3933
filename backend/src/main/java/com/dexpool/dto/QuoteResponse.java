// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Fee-inclusive swap quote. Reserves are echoed back when the caller supplied them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class QuoteResponse {
    public final String amountIn;
    public final String reserveIn;
    public final String reserveOut;
    public final String direction;
    public final String amountOut;
    public final long feeBps;

    public QuoteResponse(String amountIn, String reserveIn, String reserveOut,
                         String direction, String amountOut, long feeBps) {
        this.amountIn = amountIn;
        this.reserveIn = reserveIn;
        this.reserveOut = reserveOut;
        this.direction = direction;
        this.amountOut = amountOut;
        this.feeBps = feeBps;
    }
}
