// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the NrQuantiles project.

package com.newrelic.nrquantiles;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

// Collects unsorted raw observations until the caller flushes them into a summary.
// generateEntryList() returns the observations sorted by value with equal values collapsed, which is the
// input QuantileSummary.buildFromBufferEntries() expects.
//
// When to flush is up to the caller. A typical loop:
//   buffer.push(value, weight);
//   if (buffer.isFull()) {
//       summary.merge(new WeightedQuantileSummary(buffer.generateEntryList()));
//       summary.compress(blockSize);
//   }
//
// Not thread safe.
public class WeightedQuantileBuffer {
    private static final Logger logger = LoggerFactory.getLogger(WeightedQuantileBuffer.class);

    public static final long DEFAULT_BLOCK_SIZE = 1024;
    public static final long DEFAULT_MAX_ELEMENTS = Integer.MAX_VALUE;

    private final int maxSize;
    private List<BufferEntry> entries;

    public WeightedQuantileBuffer() {
        this(DEFAULT_BLOCK_SIZE, DEFAULT_MAX_ELEMENTS);
    }

    public WeightedQuantileBuffer(final long blockSize) {
        this(blockSize, DEFAULT_MAX_ELEMENTS);
    }

    // Buffer holds up to min(2 * blockSize, maxElements) entries.
    public WeightedQuantileBuffer(final long blockSize, final long maxElements) {
        final long size = Math.min(blockSize << 1, maxElements);
        if (size <= 0 || size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Buffer size " + size + " out of range of 1 and " + Integer.MAX_VALUE
                    + " (blockSize=" + blockSize + ", maxElements=" + maxElements + ")");
        }
        maxSize = (int) size;
        entries = newEntryList();
    }

    private List<BufferEntry> newEntryList() {
        return new ArrayList<>(Math.min(maxSize, (int) DEFAULT_BLOCK_SIZE));
    }

    // Zero and negative weights, and NaN values, are ignored.
    public void push(final double value, final double weight) {
        if (isFull()) {
            throw new IllegalStateException("push(): buffer is full, maxSize=" + maxSize);
        }
        if (Double.isNaN(value) || !(weight > 0)) {
            return;
        }
        entries.add(new BufferEntry(value, weight));
    }

    // Returns buffered entries sorted by value, with the weights of equal values summed. Clears the buffer.
    @SuppressFBWarnings(value = "FE_FLOATING_POINT_EQUALITY")
    public List<BufferEntry> generateEntryList() {
        final List<BufferEntry> sorted = entries;
        entries = newEntryList();
        Collections.sort(sorted);

        final List<BufferEntry> output = new ArrayList<>(sorted.size());
        for (final BufferEntry entry : sorted) {
            final int last = output.size() - 1;
            if (last >= 0 && output.get(last).getValue() == entry.getValue()) {
                output.set(last, new BufferEntry(entry.getValue(), output.get(last).getWeight() + entry.getWeight()));
            } else {
                output.add(entry);
            }
        }

        logger.debug("generateEntryList(): {} entries, {} distinct values", sorted.size(), output.size());
        return output;
    }

    public boolean isFull() {
        return entries.size() >= maxSize;
    }

    public int getSize() {
        return entries.size();
    }

    public int getMaxSize() {
        return maxSize;
    }
}
