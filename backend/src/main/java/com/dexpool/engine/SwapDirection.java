// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.engine;

/**
 * Which reserve a swap pays into and which it pays out of.
 */
public enum SwapDirection {
    A_TO_B,
    B_TO_A;

    public boolean isAToB() {
        return this == A_TO_B;
    }
}
