// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the NrQuantiles project.

package com.newrelic.nrquantiles;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

// Array backed QuantileSummary.
//
// The entry array is owned exclusively by this instance. Merge always builds a new array, and compress
// compacts the array in place before trimming it, so no other summary and no list returned by getEntries()
// ever observes a change.
//
// Entries are immutable. Copying an array of entries is a full deep copy.

public class WeightedQuantileSummary implements QuantileSummary {
    private static final Logger logger = LoggerFactory.getLogger(WeightedQuantileSummary.class);

    private static final SummaryEntry[] EMPTY_ENTRIES = new SummaryEntry[0];

    private SummaryEntry[] entries;

    public WeightedQuantileSummary() {
        entries = EMPTY_ENTRIES;
    }

    public WeightedQuantileSummary(final List<BufferEntry> sortedSamples) {
        this();
        buildFromBufferEntries(sortedSamples);
    }

    // Caller must not modify the array afterwards.
    private WeightedQuantileSummary(final SummaryEntry[] entries) {
        this.entries = entries;
    }

    @Override
    public QuantileSummary deepCopy() {
        return new WeightedQuantileSummary(entries.clone());
    }

    @Override
    public void buildFromBufferEntries(final List<BufferEntry> sortedSamples) {
        assert isSortedByValue(sortedSamples) : "buildFromBufferEntries(): samples not sorted by value";

        final SummaryEntry[] newEntries = new SummaryEntry[sortedSamples.size()];
        double cumWeight = 0;
        int i = 0;
        for (final BufferEntry sample : sortedSamples) {
            final double weight = sample.getWeight();
            newEntries[i++] = new SummaryEntry(sample.getValue(), weight, cumWeight, cumWeight + weight);
            cumWeight += weight;
        }
        entries = newEntries;
    }

    private static boolean isSortedByValue(final List<BufferEntry> samples) {
        for (int i = 1; i < samples.size(); i++) {
            if (samples.get(i - 1).getValue() > samples.get(i).getValue()) {
                return false;
            }
        }
        return true;
    }

    @Override
    public QuantileSummary merge(final QuantileSummary other) {
        if (other instanceof ConcurrentQuantileSummary) {
            return merge(((ConcurrentQuantileSummary) other).getSummary());
        }
        if (!(other instanceof WeightedQuantileSummary)) {
            throw new IllegalArgumentException("WeightedQuantileSummary cannot merge with " + other.getClass().getName());
        }
        return merge(this, (WeightedQuantileSummary) other);
    }

    // Merge 2 summaries. Output in "a". Does not modify "b". Returns a.
    //
    // Both entry arrays are sorted, so the values are stacked in linear time as in merge sort.
    // Rank bounds are composed rather than copied: an entry from one side gets, as its lower bound, the lowest
    // rank known to be taken by the other side so far (nextMinRank of the other side's last popped entry),
    // and as its upper bound, the highest rank the other side's pending entry may start at (its prevMaxRank).
    // Equal values collapse into one entry whose bounds are the plain sums.
    //
    public static WeightedQuantileSummary merge(final WeightedQuantileSummary a, final WeightedQuantileSummary b) {
        final SummaryEntry[] otherEntries = b.entries;
        if (otherEntries.length == 0) {
            return a;
        }
        if (a.entries.length == 0) {
            a.entries = otherEntries.clone();
            return a;
        }

        final SummaryEntry[] baseEntries = a.entries;
        final SummaryEntry[] merged = new SummaryEntry[baseEntries.length + otherEntries.length];

        int i = 0;
        int j = 0;
        int num = 0;
        double nextMinRank1 = 0;
        double nextMinRank2 = 0;

        while (i != baseEntries.length && j != otherEntries.length) {
            final SummaryEntry it1 = baseEntries[i];
            final SummaryEntry it2 = otherEntries[j];
            if (it1.getValue() < it2.getValue()) {
                merged[num] = new SummaryEntry(it1.getValue(), it1.getWeight(),
                        it1.getMinRank() + nextMinRank2,
                        it1.getMaxRank() + it2.getPrevMaxRank());
                nextMinRank1 = it1.getNextMinRank();
                i++;
            } else if (it1.getValue() > it2.getValue()) {
                merged[num] = new SummaryEntry(it2.getValue(), it2.getWeight(),
                        it2.getMinRank() + nextMinRank1,
                        it2.getMaxRank() + it1.getPrevMaxRank());
                nextMinRank2 = it2.getNextMinRank();
                j++;
            } else {
                merged[num] = new SummaryEntry(it1.getValue(), it1.getWeight() + it2.getWeight(),
                        it1.getMinRank() + it2.getMinRank(),
                        it1.getMaxRank() + it2.getMaxRank());
                nextMinRank1 = it1.getNextMinRank();
                nextMinRank2 = it2.getNextMinRank();
                i++;
                j++;
            }
            num++;
        }

        // Fill in the residual. Nothing more can arrive from the exhausted side.
        final double lastMaxRank2 = otherEntries[otherEntries.length - 1].getMaxRank();
        while (i != baseEntries.length) {
            final SummaryEntry it1 = baseEntries[i];
            merged[num++] = new SummaryEntry(it1.getValue(), it1.getWeight(),
                    it1.getMinRank() + nextMinRank2,
                    it1.getMaxRank() + lastMaxRank2);
            i++;
        }
        final double lastMaxRank1 = baseEntries[baseEntries.length - 1].getMaxRank();
        while (j != otherEntries.length) {
            final SummaryEntry it2 = otherEntries[j];
            merged[num++] = new SummaryEntry(it2.getValue(), it2.getWeight(),
                    it2.getMinRank() + nextMinRank1,
                    it2.getMaxRank() + lastMaxRank1);
            j++;
        }

        a.entries = num == merged.length ? merged : Arrays.copyOf(merged, num);
        return a;
    }

    // Buckets consecutive entries and keeps the last entry of each bucket as its representative.
    //
    // A bucket started at anchor ri admits entry ni while the rank gap from the anchor,
    // entries[ni].prevMaxRank - entries[ri].nextMinRank, stays within epsDelta. The accumulator rations bucket
    // sizes: each admission adds sizeHint, each closed bucket subtracts the entry count, so a bucket may admit
    // about size / sizeHint entries on average and the slack is not all spent on the first buckets.
    //
    // Representatives are always original entries. The first and the last entry are always kept.
    @Override
    public void compress(long sizeHint, final double minEps) {
        // No-op if we're already within the size requirement.
        sizeHint = Math.max(sizeHint, 2);
        final int size = entries.length;
        if (size <= sizeHint) {
            return;
        }

        // Max error bound delta resulting from this compression.
        final double epsDelta = getTotalWeight() * Math.max(1.0 / sizeHint, minEps);

        long addAccumulator = 0;
        final long addStep = size;

        int wi = 1;
        int li = wi;

        for (int ri = 0; ri + 1 != size; ) {
            int ni = ri + 1;
            while (ni != size && addAccumulator < addStep
                    && entries[ni].getPrevMaxRank() - entries[ri].getNextMinRank() <= epsDelta) {
                addAccumulator += sizeHint;
                ni++;
            }
            // Don't close a zero width bucket on a duplicate entry.
            if (entries[ri].equals(entries[ni - 1])) {
                ri++;
            } else {
                ri = ni - 1;
            }

            entries[wi++] = entries[ri];
            li = ri;
            addAccumulator -= addStep;
        }

        if (li + 1 != size) {
            entries[wi++] = entries[size - 1];
        }

        entries = Arrays.copyOf(entries, wi);

        logger.debug("compress(): {} entries to {}, sizeHint={}, epsDelta={}", size, wi, sizeHint, epsDelta);
    }

    // Runs a soft compression over a copy of the summary and returns the remaining values.
    // The compression epsilon is the current error plus 1 / numBoundaries, which is about what the
    // compression itself adds, so the result keeps both the approximation bound and at least
    // numBoundaries distinct values.
    @Override
    public double[] generateBoundaries(final long numBoundaries) {
        if (entries.length == 0) {
            return new double[0];
        }

        final WeightedQuantileSummary compressed = new WeightedQuantileSummary(entries.clone());
        final double compressionEps = getApproximationError() + 1.0 / numBoundaries;
        compressed.compress(numBoundaries, compressionEps);

        final double[] output = new double[compressed.entries.length];
        for (int i = 0; i < output.length; i++) {
            output[i] = compressed.entries[i].getValue();
        }
        return output;
    }

    // One forward pass over the entries, O(entries + numQuantiles), instead of numQuantiles rank queries.
    // Ranks are compared doubled to stay on the midpoint of each entry's [minRank, maxRank] interval.
    @Override
    public double[] generateQuantiles(long numQuantiles) {
        if (entries.length == 0) {
            return new double[0];
        }
        if (numQuantiles < 2) {
            numQuantiles = 2;
        }

        final double totalWeight = getTotalWeight();
        final double[] output = new double[(int) numQuantiles + 1];
        int curIdx = 0;

        for (int rank = 0; rank <= numQuantiles; rank++) {
            final double d2 = 2 * (rank * totalWeight / numQuantiles);
            int nextIdx = curIdx + 1;
            while (nextIdx < entries.length && d2 >= entries[nextIdx].getMinRank() + entries[nextIdx].getMaxRank()) {
                nextIdx++;
            }
            curIdx = nextIdx - 1;

            // Pick the closer of the two bracketing entries. Ties go to the later one.
            if (nextIdx == entries.length
                    || d2 < entries[curIdx].getNextMinRank() + entries[nextIdx].getPrevMaxRank()) {
                output[rank] = entries[curIdx].getValue();
            } else {
                output[rank] = entries[nextIdx].getValue();
            }
        }
        return output;
    }

    @Override
    public double getApproximationError() {
        if (entries.length == 0) {
            return 0;
        }

        double maxGap = 0;
        for (int i = 1; i < entries.length; i++) {
            final SummaryEntry it = entries[i];
            maxGap = Math.max(maxGap, it.getMaxRank() - it.getMinRank() - it.getWeight());
            maxGap = Math.max(maxGap, it.getPrevMaxRank() - entries[i - 1].getNextMinRank());
        }
        return maxGap / getTotalWeight();
    }

    @Override
    public double getMinValue() {
        return entries.length == 0 ? 0 : entries[0].getValue();
    }

    @Override
    public double getMaxValue() {
        return entries.length == 0 ? 0 : entries[entries.length - 1].getValue();
    }

    @Override
    public double getTotalWeight() {
        return entries.length == 0 ? 0 : entries[entries.length - 1].getMaxRank();
    }

    @Override
    public long getSize() {
        return entries.length;
    }

    @Override
    public void clear() {
        entries = EMPTY_ENTRIES;
    }

    @Override
    public List<SummaryEntry> getEntries() {
        return Collections.unmodifiableList(Arrays.asList(entries.clone()));
    }

    @NotNull
    @Override
    public Iterator<SummaryEntry> iterator() {
        return Arrays.asList(entries).iterator();
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof WeightedQuantileSummary)) {
            return false;
        }
        return Arrays.equals(entries, ((WeightedQuantileSummary) obj).entries);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(entries);
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        builder.append("size=" + entries.length);
        builder.append(", totalWeight=" + getTotalWeight());
        builder.append(", entries={");
        for (final SummaryEntry entry : entries) {
            builder.append(entry);
            builder.append(",");
        }
        builder.append("}");
        return builder.toString();
    }
}
