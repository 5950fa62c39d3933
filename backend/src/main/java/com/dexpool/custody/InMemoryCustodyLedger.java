// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.custody;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Balance book for a fixed set of assets, with one account holding the pooled funds.
 *
 * Stands in for the token contracts: balances are created by {@link #mint} and moved by the
 * pool's pull/push calls. All methods are synchronized on the ledger.
 */
public class InMemoryCustodyLedger implements CustodyGateway {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryCustodyLedger.class);

    private final String poolAccount;
    // asset -> holder -> balance
    private final Map<String, Map<String, BigInteger>> balances = new HashMap<>();

    public InMemoryCustodyLedger(final String poolAccount, final Set<String> assets) {
        if (poolAccount == null || poolAccount.isBlank()) {
            throw new IllegalArgumentException("poolAccount is required");
        }
        if (assets == null || assets.isEmpty()) {
            throw new IllegalArgumentException("at least one asset is required");
        }
        this.poolAccount = poolAccount;
        for (String asset : assets) {
            balances.put(asset, new HashMap<>());
        }
    }

    public String poolAccount() {
        return poolAccount;
    }

    @Override
    public boolean isPoolAccount(final String party) {
        return poolAccount.equals(party);
    }

    public synchronized Set<String> assets() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(balances.keySet()));
    }

    /**
     * Credit freshly issued units of {@code asset} to {@code holder}.
     *
     * @throws IllegalArgumentException on unknown asset, blank holder, the pool account as holder,
     *         or non-positive amount
     */
    public synchronized BigInteger mint(final String holder, final String asset, final BigInteger amount) {
        Map<String, BigInteger> book = balances.get(asset);
        if (book == null) {
            throw new IllegalArgumentException("Unknown asset: " + asset);
        }
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("holder is required");
        }
        if (isPoolAccount(holder)) {
            throw new IllegalArgumentException("Cannot mint into the pool account " + holder);
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive, got: " + amount);
        }
        BigInteger updated = book.merge(holder, amount, BigInteger::add);
        logger.info("Minted {} {} to {} (balance {})", amount, asset, holder, updated);
        return updated;
    }

    public synchronized BigInteger balanceOf(final String holder, final String asset) {
        Map<String, BigInteger> book = balances.get(asset);
        if (book == null) {
            return BigInteger.ZERO;
        }
        return book.getOrDefault(holder, BigInteger.ZERO);
    }

    /**
     * Every asset balance of {@code holder}, zero balances included, sorted by asset.
     */
    public synchronized Map<String, BigInteger> balancesOf(final String holder) {
        Map<String, BigInteger> out = new TreeMap<>();
        for (Map.Entry<String, Map<String, BigInteger>> entry : balances.entrySet()) {
            out.put(entry.getKey(), entry.getValue().getOrDefault(holder, BigInteger.ZERO));
        }
        return out;
    }

    @Override
    public synchronized boolean pullFrom(final String holder, final String asset, final BigInteger amount) {
        return move(holder, poolAccount, asset, amount);
    }

    @Override
    public synchronized boolean pushTo(final String holder, final String asset, final BigInteger amount) {
        return move(poolAccount, holder, asset, amount);
    }

    private boolean move(final String from, final String to, final String asset, final BigInteger amount) {
        Map<String, BigInteger> book = balances.get(asset);
        if (book == null) {
            logger.warn("Transfer rejected: unknown asset {}", asset);
            return false;
        }
        if (from == null || to == null || amount == null || amount.signum() <= 0) {
            logger.warn("Transfer rejected: invalid arguments from={} to={} amount={}", from, to, amount);
            return false;
        }
        BigInteger available = book.getOrDefault(from, BigInteger.ZERO);
        if (available.compareTo(amount) < 0) {
            logger.warn("Transfer rejected: {} holds {} {} but {} requested", from, available, asset, amount);
            return false;
        }
        BigInteger remaining = available.subtract(amount);
        if (remaining.signum() == 0) {
            book.remove(from);
        } else {
            book.put(from, remaining);
        }
        book.merge(to, amount, BigInteger::add);
        logger.debug("Transferred {} {} from {} to {}", amount, asset, from, to);
        return true;
    }
}
