// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

/**
 * Spot price of the base asset quoted in the other one, floor(reserveB / reserveA).
 */
public class PriceResponse {
    public final String base;
    public final String quote;
    public final String price;

    public PriceResponse(String base, String quote, String price) {
        this.base = base;
        this.quote = quote;
        this.price = price;
    }
}
