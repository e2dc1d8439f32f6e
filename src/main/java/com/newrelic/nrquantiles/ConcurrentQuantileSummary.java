// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the NrQuantiles project.

package com.newrelic.nrquantiles;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;

import java.util.Iterator;
import java.util.List;

// A concurrency wrapper for QuantileSummary. Methods are defined as "synchronized" for multi-thread access.
// NOTES:
// 1. For entry iteration, caller must explicitly use "synchronized" on the whole iterator block.
//    Example:
//   QuantileSummary summary;
//   synchronized(summary) {
//       for (SummaryEntry entry : summary) {
//           ...
//       }
//   }
// 2. When calling merge(), caller must ensure that "other" is also protected from concurrent modification.
//
public class ConcurrentQuantileSummary implements QuantileSummary {
    protected final QuantileSummary summary;

    @SuppressFBWarnings(value = "EI_EXPOSE_REP2")
    public ConcurrentQuantileSummary(final QuantileSummary summary) {
        this.summary = summary;
    }

    @Override
    public QuantileSummary deepCopy() {
        return new ConcurrentQuantileSummary(summary.deepCopy());
    }

    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    public QuantileSummary getSummary() {
        return summary;
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof ConcurrentQuantileSummary)) {
            return false;
        }
        return summary.equals(((ConcurrentQuantileSummary) obj).summary);
    }

    @Override
    public int hashCode() {
        return summary.hashCode(); // Hash code collision between "this" and "this.summary" is acceptable.
    }

    @Override
    public String toString() {
        return summary.toString();
    }

    @Override
    public synchronized void buildFromBufferEntries(final List<BufferEntry> sortedSamples) {
        summary.buildFromBufferEntries(sortedSamples);
    }

    // Caller must ensure that "other" is also protected from concurrent modification.
    // Returns "this" so that the result stays protected.
    @Override
    public synchronized QuantileSummary merge(final QuantileSummary other) {
        summary.merge((other instanceof ConcurrentQuantileSummary) ? ((ConcurrentQuantileSummary) other).summary : other);
        return this;
    }

    @Override
    public synchronized void compress(final long sizeHint, final double minEps) {
        summary.compress(sizeHint, minEps);
    }

    @Override
    public synchronized double[] generateBoundaries(final long numBoundaries) {
        return summary.generateBoundaries(numBoundaries);
    }

    @Override
    public synchronized double[] generateQuantiles(final long numQuantiles) {
        return summary.generateQuantiles(numQuantiles);
    }

    @Override
    public synchronized double getApproximationError() {
        return summary.getApproximationError();
    }

    @Override
    public synchronized double getMinValue() {
        return summary.getMinValue();
    }

    @Override
    public synchronized double getMaxValue() {
        return summary.getMaxValue();
    }

    @Override
    public synchronized double getTotalWeight() {
        return summary.getTotalWeight();
    }

    @Override
    public synchronized long getSize() {
        return summary.getSize();
    }

    @Override
    public synchronized void clear() {
        summary.clear();
    }

    @Override
    public synchronized List<SummaryEntry> getEntries() {
        return summary.getEntries();
    }

    // The whole iterator block must be protected by "synchronized". See comment at beginning of this class.
    // The "iterator()" method is also defined as "synchronized" for extra safety.
    @NotNull
    @Override
    public synchronized Iterator<SummaryEntry> iterator() {
        return summary.iterator();
    }
}
