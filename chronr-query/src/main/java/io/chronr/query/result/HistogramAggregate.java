package io.chronr.query.result;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;

/**
 * Per bucket counts of series. Bucket <code>i</code> covers <code>[bounds[i-1], bounds[i])</code>, the first one starts at 0.
 */
public class HistogramAggregate extends Aggregate {
    private final double[] bounds;
    private final int[] counts;

    public HistogramAggregate(double[] bounds, int[] counts) {
        if (bounds.length != counts.length) {
            throw new IllegalArgumentException("bounds and counts differ in length");
        }
        this.bounds = bounds.clone();
        this.counts = counts.clone();
    }

    /**
     * Upper bounds of the buckets, a copy.
     */
    @JsonProperty("bounds")
    public double[] bounds() {
        return bounds.clone();
    }

    /**
     * A copy.
     */
    @JsonProperty("counts")
    public int[] counts() {
        return counts.clone();
    }

    public int bucketCount() {
        return counts.length;
    }

    @Override
    public Kind kind() {
        return Kind.HISTOGRAM;
    }

    public int total() {
        int total = 0;
        for (int c : counts) {
            total += c;
        }
        return total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        HistogramAggregate that = (HistogramAggregate) o;
        return Arrays.equals(bounds, that.bounds) && Arrays.equals(counts, that.counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bounds) * 31 + Arrays.hashCode(counts);
    }
}
