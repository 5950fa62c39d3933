// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

import java.util.Map;

public class BalanceResponse {
    public final String party;
    public final Map<String, String> balances;

    public BalanceResponse(String party, Map<String, String> balances) {
        this.party = party;
        this.balances = balances;
    }
}
