package io.chronr.query.func;

import java.util.Iterator;

import io.chronr.query.CancellationSignal;
import io.chronr.query.result.SeriesValues;
import io.chronr.segment.Partition;
import io.chronr.segment.Sample;

/**
 * Reduces a value column into one number.
 * 
 * The point of {@link Op#MIN} and {@link Op#MAX} is stamped with the time of the first extreme
 * sample, the others with the latest timestamp seen.
 */
public class ScalarAggregator implements Aggregator<Double> {

    public enum Op {
        SUM,
        MIN,
        MAX,
        AVG,
    }

    private final Op op;
    private final String valueColumn;

    public ScalarAggregator(Op op, String valueColumn) {
        this.op = op;
        this.valueColumn = valueColumn;
    }

    @Override
    public SeriesValues<Double> aggregate(Partition partition, CancellationSignal signal) {
        Iterator<Sample> it = partition.readValues(valueColumn);
        long count = 0;
        double acc = 0;
        long timestamp = Long.MIN_VALUE;
        while (it.hasNext()) {
            signal.checkCancelled();
            Sample s = it.next();
            if (Double.isNaN(s.value)) {
                continue;
            }
            switch (op) {
                case SUM:
                case AVG:
                    acc += s.value;
                    timestamp = Math.max(timestamp, s.timestamp);
                    break;
                case MIN:
                    if (count == 0 || s.value < acc) {
                        acc = s.value;
                        timestamp = s.timestamp;
                    }
                    break;
                case MAX:
                    if (count == 0 || s.value > acc) {
                        acc = s.value;
                        timestamp = s.timestamp;
                    }
                    break;
                default:
                    throw new IllegalStateException("Illegal op: " + op);
            }
            count++;
        }
        if (count == 0) {
            return SeriesValues.empty(partition.seriesKey());
        }
        double value = op == Op.AVG ? acc / count : acc;
        return SeriesValues.single(partition.seriesKey(), timestamp, value);
    }
}
