// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.events;

/**
 * Receives pool notifications in commit order, only after state and transfers are confirmed.
 */
public interface PoolEventSink {

    void publish(PoolEvent event);
}
