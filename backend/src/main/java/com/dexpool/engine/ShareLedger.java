// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.engine;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Provider -> shares. A provider with zero shares has no entry.
 *
 * Not thread-safe; the owning engine guards it.
 */
final class ShareLedger {

    private final Map<String, BigInteger> shares = new TreeMap<>();

    BigInteger sharesOf(final String provider) {
        return shares.getOrDefault(provider, BigInteger.ZERO);
    }

    void credit(final String provider, final BigInteger amount) {
        set(provider, sharesOf(provider).add(amount));
    }

    void debit(final String provider, final BigInteger amount) {
        BigInteger held = sharesOf(provider);
        if (held.compareTo(amount) < 0) {
            throw new IllegalStateException("Cannot debit " + amount + " shares from " + provider + " holding " + held);
        }
        set(provider, held.subtract(amount));
    }

    /**
     * Overwrite an entry; used to restore a provider's balance on rollback.
     */
    void set(final String provider, final BigInteger amount) {
        if (amount.signum() == 0) {
            shares.remove(provider);
        } else {
            shares.put(provider, amount);
        }
    }

    Map<String, BigInteger> snapshot() {
        return Collections.unmodifiableMap(new TreeMap<>(shares));
    }
}
