// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.engine;

import com.dexpool.common.errors.CustodyTransferFailedError;
import com.dexpool.custody.CustodyGateway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TransferPlanTest {

    private static final BigInteger TEN = BigInteger.TEN;
    private static final BigInteger FIVE = BigInteger.valueOf(5);
    private static final BigInteger SEVEN = BigInteger.valueOf(7);

    @Mock
    private CustodyGateway custody;

    @Test
    void testZeroAmountTransfers_areSkipped() {
        TransferPlan plan = new TransferPlan()
            .push("alice", "TKA", BigInteger.ZERO)
            .push("alice", "TKB", TEN);

        assertThat(plan.transfers()).hasSize(1);
        assertThat(plan.transfers().get(0).asset()).isEqualTo("TKB");
    }

    @Test
    void testAllSucceed_runsInOrder() {
        when(custody.pullFrom("alice", "TKA", TEN)).thenReturn(true);
        when(custody.pushTo("alice", "TKB", FIVE)).thenReturn(true);

        Optional<CustodyTransferFailedError> failure = new TransferPlan()
            .pull("alice", "TKA", TEN)
            .push("alice", "TKB", FIVE)
            .execute(custody);

        assertThat(failure).isEmpty();
        InOrder inOrder = inOrder(custody);
        inOrder.verify(custody).pullFrom("alice", "TKA", TEN);
        inOrder.verify(custody).pushTo("alice", "TKB", FIVE);
        verifyNoMoreInteractions(custody);
    }

    @Test
    void testFailure_reversesCompletedTransfersNewestFirst() {
        when(custody.pullFrom("alice", "TKA", TEN)).thenReturn(true);
        when(custody.pullFrom("alice", "TKB", FIVE)).thenReturn(true);
        when(custody.pushTo("alice", "TKA", SEVEN)).thenReturn(false);
        when(custody.pushTo("alice", "TKB", FIVE)).thenReturn(true);
        when(custody.pushTo("alice", "TKA", TEN)).thenReturn(true);

        Optional<CustodyTransferFailedError> failure = new TransferPlan()
            .pull("alice", "TKA", TEN)
            .pull("alice", "TKB", FIVE)
            .push("alice", "TKA", SEVEN)
            .execute(custody);

        assertThat(failure).hasValueSatisfying(error -> {
            assertThat(error.isCompensated()).isTrue();
            assertThat(error.message()).contains("push 7 TKA");
        });
        InOrder inOrder = inOrder(custody);
        inOrder.verify(custody).pushTo("alice", "TKA", SEVEN);
        inOrder.verify(custody).pushTo("alice", "TKB", FIVE);
        inOrder.verify(custody).pushTo("alice", "TKA", TEN);
    }

    @Test
    void testFirstTransferFails_nothingToReverse() {
        when(custody.pushTo("bob", "TKB", TEN)).thenReturn(false);

        Optional<CustodyTransferFailedError> failure = new TransferPlan()
            .push("bob", "TKB", TEN)
            .pull("bob", "TKA", TEN)
            .execute(custody);

        assertThat(failure).isPresent();
        assertThat(failure.get().isCompensated()).isTrue();
        verify(custody, never()).pullFrom(anyString(), anyString(), any());
    }

    @Test
    void testThrowingCompensation_reportedAsUncompensated() {
        when(custody.pullFrom("bob", "TKA", TEN)).thenReturn(true);
        when(custody.pullFrom("bob", "TKB", TEN)).thenReturn(false);
        when(custody.pushTo("bob", "TKA", TEN)).thenThrow(new IllegalStateException("boom"));

        Optional<CustodyTransferFailedError> failure = new TransferPlan()
            .pull("bob", "TKA", TEN)
            .pull("bob", "TKB", TEN)
            .execute(custody);

        assertThat(failure).hasValueSatisfying(error -> assertThat(error.isCompensated()).isFalse());
    }

    @Test
    void testReverse_flipsDirection() {
        TransferPlan.Transfer pull = new TransferPlan.Transfer(TransferPlan.Kind.PULL, "alice", "TKA", TEN);

        assertThat(pull.reverse().kind()).isEqualTo(TransferPlan.Kind.PUSH);
        assertThat(pull.reverse().reverse()).isEqualTo(pull);
    }
}
