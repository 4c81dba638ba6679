package io.chronr.query.func;

import com.google.common.base.Preconditions;

import java.util.Arrays;

import io.chronr.query.result.Aggregate;
import io.chronr.query.result.HistogramAggregate;
import io.chronr.query.result.Point;
import io.chronr.query.result.SeriesValues;

/**
 * Counts series by their single value, into buckets of geometrically growing width.
 * 
 * With upper bound <code>max</code> and <code>n</code> buckets, bucket <code>i</code> ends at
 * <code>max^((i+1)/n)</code> and starts where bucket <code>i-1</code> ends, bucket 0 starts at 0.
 * Buckets are half open, so <code>[0, max)</code> is covered. Values out of it, and NaN, are dropped.
 */
public class HistogramCombiner implements Combiner {
    public static final int DEFAULT_BUCKETS = 10;

    private final double max;
    private final double[] bounds;

    public HistogramCombiner(double max, int buckets) {
        Preconditions.checkArgument(max > 1, "histogram max must be greater than 1");
        Preconditions.checkArgument(buckets > 0, "histogram buckets must be positive");
        this.max = max;
        this.bounds = new double[buckets];
        for (int i = 0; i < buckets; i++) {
            bounds[i] = Math.pow(max, (i + 1) / (double) buckets);
        }
        bounds[buckets - 1] = max;
    }

    public int bucketCount() {
        return bounds.length;
    }

    /**
     * @return the bucket of <code>value</code>, or -1 if it falls out of all of them.
     */
    public int bucketOf(double value) {
        if (!(value >= 0) || value >= max) {
            return -1;
        }
        int idx = Arrays.binarySearch(bounds, value);
        // On a bound exactly: buckets are half open, it belongs to the next one.
        return idx >= 0 ? idx + 1 : -(idx + 1);
    }

    @Override
    public Accumulator newAccumulator() {
        return new HistogramAccumulator();
    }

    class HistogramAccumulator implements Accumulator {
        private final int[] counts = new int[bounds.length];

        private HistogramCombiner combiner() {
            return HistogramCombiner.this;
        }

        @Override
        public void add(SeriesValues<?> sv) {
            if (sv.isEmpty()) {
                return;
            }
            if (sv.size() != 1) {
                throw new IllegalStateException("Histogram requires one value per series, got " + sv.size() + " of " + sv.seriesKey);
            }
            Point<?> point = sv.points.get(0);
            if (!(point.value instanceof Number)) {
                throw new IllegalStateException("Histogram requires a numeric value, got " + point.value);
            }
            int bucket = bucketOf(((Number) point.value).doubleValue());
            if (bucket >= 0) {
                counts[bucket]++;
            }
        }

        @Override
        public void merge(Accumulator other) {
            HistogramAccumulator o = (HistogramAccumulator) other;
            if (o.combiner() != combiner() && !Arrays.equals(o.combiner().bounds, bounds)) {
                throw new IllegalStateException("Can not merge histograms of different buckets");
            }
            for (int i = 0; i < counts.length; i++) {
                counts[i] += o.counts[i];
            }
        }

        @Override
        public Aggregate result() {
            return new HistogramAggregate(bounds, counts);
        }
    }
}
