// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the NrQuantiles project.

package com.newrelic.nrquantiles;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

// One sample in a summary, with conservative bounds on its cumulative rank in the full data set.
// - minRank: lower bound on total weight strictly before this entry (rank of the entry's left edge).
// - maxRank: upper bound on total weight up to and including this entry (rank of the entry's right edge).
// Instances are immutable, so summaries may share them freely.
public final class SummaryEntry {
    private final double value;
    private final double weight;
    private final double minRank;
    private final double maxRank;

    public SummaryEntry(final double value, final double weight, final double minRank, final double maxRank) {
        this.value = value;
        this.weight = weight;
        this.minRank = minRank;
        this.maxRank = maxRank;
    }

    public double getValue() {
        return value;
    }

    public double getWeight() {
        return weight;
    }

    public double getMinRank() {
        return minRank;
    }

    public double getMaxRank() {
        return maxRank;
    }

    // Upper bound on rank of everything strictly before this entry.
    public double getPrevMaxRank() {
        return maxRank - weight;
    }

    // Lower bound on rank of everything at or after this entry.
    public double getNextMinRank() {
        return minRank + weight;
    }

    // Exact comparison on all four fields. Compression relies on this to detect duplicate entries.
    @SuppressFBWarnings(value = "FE_FLOATING_POINT_EQUALITY")
    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof SummaryEntry)) {
            return false;
        }
        final SummaryEntry other = (SummaryEntry) obj;
        return value == other.value && weight == other.weight && minRank == other.minRank && maxRank == other.maxRank;
    }

    @Override
    public int hashCode() {
        int result = hashDouble(value);
        result = 31 * result + hashDouble(weight);
        result = 31 * result + hashDouble(minRank);
        result = 31 * result + hashDouble(maxRank);
        return result;
    }

    // Hash consistent with ==, which treats -0.0 and 0.0 as equal.
    static int hashDouble(final double d) {
        return Double.hashCode(d == 0 ? 0.0 : d);
    }

    @Override
    public String toString() {
        return "{value=" + value + ", weight=" + weight + ", minRank=" + minRank + ", maxRank=" + maxRank + "}";
    }
}
