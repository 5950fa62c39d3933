// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.dto;

public class ShareResponse {
    public final String party;
    public final String shares;
    public final String totalShares;

    public ShareResponse(String party, String shares, String totalShares) {
        this.party = party;
        this.shares = shares;
        this.totalShares = totalShares;
    }
}
