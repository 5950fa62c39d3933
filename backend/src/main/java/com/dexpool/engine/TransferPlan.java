// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.engine;

import com.dexpool.common.errors.CustodyTransferFailedError;
import com.dexpool.custody.CustodyGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Ordered custody transfers belonging to one pool operation.
 *
 * If a transfer fails, the ones already done are reversed newest first, so the operation
 * leaves no custody effect behind. Zero-amount legs are skipped.
 */
final class TransferPlan {

    private static final Logger logger = LoggerFactory.getLogger(TransferPlan.class);

    enum Kind { PULL, PUSH }

    record Transfer(Kind kind, String holder, String asset, BigInteger amount) {

        Transfer reverse() {
            return new Transfer(kind == Kind.PULL ? Kind.PUSH : Kind.PULL, holder, asset, amount);
        }

        @Override
        public String toString() {
            return (kind == Kind.PULL ? "pull " : "push ") + amount + " " + asset
                    + (kind == Kind.PULL ? " from " : " to ") + holder;
        }
    }

    private final List<Transfer> transfers = new ArrayList<>();

    TransferPlan pull(final String holder, final String asset, final BigInteger amount) {
        return add(new Transfer(Kind.PULL, holder, asset, amount));
    }

    TransferPlan push(final String holder, final String asset, final BigInteger amount) {
        return add(new Transfer(Kind.PUSH, holder, asset, amount));
    }

    List<Transfer> transfers() {
        return List.copyOf(transfers);
    }

    /**
     * Run every transfer in order.
     *
     * @return empty when all succeeded, otherwise the failure after compensation was attempted
     */
    Optional<CustodyTransferFailedError> execute(final CustodyGateway custody) {
        Deque<Transfer> done = new ArrayDeque<>();
        for (Transfer transfer : transfers) {
            if (!attempt(custody, transfer)) {
                boolean compensated = compensate(custody, done);
                String details = "Custody refused to " + transfer
                        + (compensated ? "" : "; reversing earlier transfers also failed");
                return Optional.of(new CustodyTransferFailedError(details, compensated));
            }
            done.push(transfer);
        }
        return Optional.empty();
    }

    private boolean compensate(final CustodyGateway custody, final Deque<Transfer> done) {
        boolean allReversed = true;
        while (!done.isEmpty()) {
            Transfer reversal = done.pop().reverse();
            if (!attempt(custody, reversal)) {
                logger.error("Compensation failed, custody and pool books now disagree: {}", reversal);
                allReversed = false;
            }
        }
        return allReversed;
    }

    private boolean attempt(final CustodyGateway custody, final Transfer transfer) {
        try {
            boolean ok = transfer.kind() == Kind.PULL
                    ? custody.pullFrom(transfer.holder(), transfer.asset(), transfer.amount())
                    : custody.pushTo(transfer.holder(), transfer.asset(), transfer.amount());
            if (!ok) {
                logger.error("Custody transfer refused: {}", transfer);
            }
            return ok;
        } catch (RuntimeException e) {
            logger.error("Custody transfer threw: {}", transfer, e);
            return false;
        }
    }

    private TransferPlan add(final Transfer transfer) {
        if (transfer.amount().signum() > 0) {
            transfers.add(transfer);
        }
        return this;
    }
}
