// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.dexpool.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded in-memory history of pool notifications, newest first.
 */
public class PoolEventHistory implements PoolEventSink {

    private static final Logger LOG = LoggerFactory.getLogger(PoolEventHistory.class);

    private final int maxEvents;
    private final Deque<PoolEvent> history = new ArrayDeque<>();

    public PoolEventHistory(final int maxEvents) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("maxEvents must be positive, got: " + maxEvents);
        }
        this.maxEvents = maxEvents;
    }

    @Override
    public synchronized void publish(final PoolEvent event) {
        history.addFirst(event);
        while (history.size() > maxEvents) {
            PoolEvent dropped = history.removeLast();
            LOG.debug("Event history full, dropping #{}", dropped.sequence());
        }
    }

    /**
     * Up to {@code limit} most recent events, newest first.
     */
    public synchronized List<PoolEvent> recent(final int limit) {
        int count = Math.max(0, Math.min(limit, history.size()));
        List<PoolEvent> out = new ArrayList<>(count);
        Iterator<PoolEvent> it = history.iterator();
        while (out.size() < count && it.hasNext()) {
            out.add(it.next());
        }
        return out;
    }

    public synchronized int size() {
        return history.size();
    }

    public int maxEvents() {
        return maxEvents;
    }
}
