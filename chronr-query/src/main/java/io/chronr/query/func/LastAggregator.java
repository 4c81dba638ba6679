package io.chronr.query.func;

import java.util.Iterator;

import io.chronr.query.CancellationSignal;
import io.chronr.query.result.SeriesValues;
import io.chronr.segment.Partition;
import io.chronr.segment.Sample;

/**
 * The chronologically last sample. When timestamps tie, the later row wins.
 */
public class LastAggregator implements Aggregator<Double> {
    private final String timestampColumn;
    private final String valueColumn;

    public LastAggregator(String timestampColumn, String valueColumn) {
        this.timestampColumn = timestampColumn;
        this.valueColumn = valueColumn;
    }

    @Override
    public SeriesValues<Double> aggregate(Partition partition, CancellationSignal signal) {
        Iterator<Sample> it = partition.readValues(timestampColumn, valueColumn);
        Sample last = null;
        while (it.hasNext()) {
            signal.checkCancelled();
            Sample s = it.next();
            if (Double.isNaN(s.value)) {
                continue;
            }
            if (last == null || s.timestamp >= last.timestamp) {
                last = s;
            }
        }
        return last == null
                ? SeriesValues.empty(partition.seriesKey())
                : SeriesValues.single(partition.seriesKey(), last.timestamp, last.value);
    }
}
