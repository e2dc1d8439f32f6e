// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the NrQuantiles project.

package com.newrelic.nrquantiles;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;

// A raw (value, weight) observation. Ordered by value only.
public final class BufferEntry implements Comparable<BufferEntry> {
    private final double value;
    private final double weight;

    public BufferEntry(final double value, final double weight) {
        this.value = value;
        this.weight = weight;
    }

    public double getValue() {
        return value;
    }

    public double getWeight() {
        return weight;
    }

    @Override
    public int compareTo(@NotNull final BufferEntry other) {
        return Double.compare(value, other.value);
    }

    @SuppressFBWarnings(value = "FE_FLOATING_POINT_EQUALITY")
    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof BufferEntry)) {
            return false;
        }
        final BufferEntry other = (BufferEntry) obj;
        return value == other.value && weight == other.weight;
    }

    @Override
    public int hashCode() {
        return 31 * SummaryEntry.hashDouble(value) + SummaryEntry.hashDouble(weight);
    }

    @Override
    public String toString() {
        return "{value=" + value + ", weight=" + weight + "}";
    }
}
