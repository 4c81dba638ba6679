package io.chronr.query.func;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import io.chronr.query.CancellationSignal;
import io.chronr.query.result.Point;
import io.chronr.query.result.SeriesValues;
import io.chronr.segment.Partition;
import io.chronr.segment.Sample;

/**
 * Splits <code>[start, end)</code> into equal width windows and reduces each of them.
 * Every window gives one point, stamped with the window start. Empty windows hold NaN.
 */
public class TimeGroupAggregator implements Aggregator<Double> {

    public enum Op {
        MIN,
        MAX,
        AVG,
    }

    private final Op op;
    private final String timestampColumn;
    private final String valueColumn;
    private final long start;
    private final long end;
    private final int windows;

    public TimeGroupAggregator(Op op, String timestampColumn, String valueColumn, long start, long end, int windows) {
        if (start >= end || windows <= 0) {
            throw new IllegalArgumentException(String.format("Illegal time group [%d, %d) / %d", start, end, windows));
        }
        this.op = op;
        this.timestampColumn = timestampColumn;
        this.valueColumn = valueColumn;
        this.start = start;
        this.end = end;
        this.windows = windows;
    }

    int windowOf(long timestamp) {
        if (timestamp < start || timestamp >= end) {
            return -1;
        }
        // In double, as the range may be wider than Long.MAX_VALUE.
        int w = (int) (((double) timestamp - start) * windows / ((double) end - start));
        return Math.min(w, windows - 1);
    }

    long windowStart(int window) {
        double offset = ((double) end - start) * window / windows;
        // The offset alone may not fit in a long, the window start always does.
        return offset < Long.MAX_VALUE ? start + (long) offset : (long) (start + offset);
    }

    @Override
    public SeriesValues<Double> aggregate(Partition partition, CancellationSignal signal) {
        double[] acc = new double[windows];
        int[] counts = new int[windows];

        Iterator<Sample> it = partition.readValues(timestampColumn, valueColumn);
        while (it.hasNext()) {
            signal.checkCancelled();
            Sample s = it.next();
            int w = windowOf(s.timestamp);
            if (w < 0 || Double.isNaN(s.value)) {
                continue;
            }
            if (counts[w] == 0) {
                acc[w] = s.value;
            } else {
                switch (op) {
                    case MIN:
                        acc[w] = Math.min(acc[w], s.value);
                        break;
                    case MAX:
                        acc[w] = Math.max(acc[w], s.value);
                        break;
                    case AVG:
                        acc[w] += s.value;
                        break;
                    default:
                        throw new IllegalStateException("Illegal op: " + op);
                }
            }
            counts[w]++;
        }

        List<Point<Double>> points = new ArrayList<>(windows);
        for (int w = 0; w < windows; w++) {
            double v;
            if (counts[w] == 0) {
                v = Double.NaN;
            } else {
                v = op == Op.AVG ? acc[w] / counts[w] : acc[w];
            }
            points.add(Point.of(windowStart(w), v));
        }
        return new SeriesValues<>(partition.seriesKey(), points);
    }
}
