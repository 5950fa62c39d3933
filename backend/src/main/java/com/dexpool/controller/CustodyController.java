// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.controller;

import com.dexpool.common.errors.ValidationError;
import com.dexpool.custody.InMemoryCustodyLedger;
import com.dexpool.dto.BalanceResponse;
import com.dexpool.dto.MintRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * CustodyController - test-asset issuance and balance lookup on the in-memory custody ledger.
 */
@RestController
@RequestMapping("/api/custody")
public class CustodyController {

    private static final Logger logger = LoggerFactory.getLogger(CustodyController.class);
    private final InMemoryCustodyLedger custody;

    public CustodyController(InMemoryCustodyLedger custody) {
        this.custody = custody;
    }

    @PostMapping("/mint")
    public BalanceResponse mint(@Valid @RequestBody MintRequest req) {
        logger.info("POST /api/custody/mint - party: {}, asset: {}, amount: {}", req.party, req.asset, req.amount);
        if (!custody.assets().contains(req.asset)) {
            throw DomainErrorStatusMapper.toHttpException(
                new ValidationError("Unknown asset " + req.asset + ", expected one of " + custody.assets()));
        }
        if (custody.isPoolAccount(req.party)) {
            throw DomainErrorStatusMapper.toHttpException(
                new ValidationError("party '" + req.party + "' is the pool custody account"));
        }
        custody.mint(req.party, req.asset, req.amount);
        return balances(req.party);
    }

    @GetMapping("/balances/{party}")
    public BalanceResponse balances(@PathVariable("party") String party) {
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<String, BigInteger> entry : custody.balancesOf(party).entrySet()) {
            out.put(entry.getKey(), entry.getValue().toString());
        }
        return new BalanceResponse(party, out);
    }
}
