// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the NrQuantiles project.

package com.newrelic.nrquantiles;

import java.util.List;

// A deterministic rank-bound summary (Greenwald-Khanna style) over a weighted data set.
// Entries are sorted by value. Each entry carries [minRank, maxRank] bounds on its true cumulative rank,
// so any rank or quantile query is within getApproximationError() * getTotalWeight() of the true answer.
//
// Implementations are not thread safe. See ConcurrentQuantileSummary for a synchronized wrapper.
public interface QuantileSummary extends Iterable<SummaryEntry> {

    // Replace the content of the summary with exact entries built from raw samples.
    // Precondition: samples are sorted by value in ascending order and weights are non-negative.
    // The precondition is not validated.
    // Zero weights are accepted but take no rank. A zero weight first sample is never picked as a quantile,
    // so generateQuantiles(n)[0] is the next value rather than getMinValue(). WeightedQuantileBuffer drops
    // such samples.
    void buildFromBufferEntries(final List<BufferEntry> sortedSamples);

    // Merge "other" into "this". Always returns "this".
    // An implementation should not modify "other", and must not share storage with it afterwards.
    QuantileSummary merge(final QuantileSummary other);

    // Reduce the summary towards max(sizeHint, 2) entries. No-op when the summary is already that small.
    // The approximation error after compression is at most max(error before, max(1 / sizeHint, minEps)).
    //
    // An entry is only dropped when the rank gap it leaves stays within epsDelta, which is
    // totalWeight * max(1 / sizeHint, minEps). Heavy entries (weight above epsDelta) and the gaps left by
    // earlier compression or merges are kept as they are. So the entry count is bounded only for exact input
    // where all weights are equal: at most max(sizeHint, 2) + 1 entries. Weighted or merged input may stay
    // well above sizeHint.
    //
    // Calling compress again with the same arguments is a no-op when the previous call left at most
    // max(sizeHint, 2) entries. Otherwise the next call may drop more entries. Entries are never added,
    // so repeated calls reach a fixed point.
    void compress(final long sizeHint, final double minEps);

    default void compress(final long sizeHint) {
        compress(sizeHint, 0);
    }

    // Returns values suitable for bucketizing the value range into buckets of roughly equal weight.
    // Contains at least numBoundaries values when the summary has that many distinct entries.
    // Returns an empty array when the summary is empty.
    double[] generateBoundaries(final long numBoundaries);

    // Returns numQuantiles + 1 values. The i-th value approximates the i / numQuantiles quantile.
    // numQuantiles below 2 is raised to 2. Returns an empty array when the summary is empty.
    double[] generateQuantiles(final long numQuantiles);

    // Returns the worst case rank error, normalized by total weight. Returns 0 if summary is empty.
    double getApproximationError();

    // Returns 0 if summary is empty.
    double getMinValue();

    // Returns 0 if summary is empty.
    double getMaxValue();

    // Total weight of all samples absorbed. Returns 0 if summary is empty.
    double getTotalWeight();

    // Number of entries.
    long getSize();

    void clear();

    // Returns a snapshot of the entries, sorted by value. Not affected by later changes to the summary.
    List<SummaryEntry> getEntries();

    // Returns a deep copy of the summary.
    QuantileSummary deepCopy();
}
