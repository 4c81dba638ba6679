package io.chronr.query.func;

import java.util.Iterator;

import io.chronr.query.CancellationSignal;
import io.chronr.query.result.SeriesValues;
import io.chronr.segment.Partition;
import io.chronr.segment.Sample;

/**
 * Number of non missing values. Unlike the other scalar functions, an empty partition counts 0.
 */
public class CountAggregator implements Aggregator<Long> {
    private final String valueColumn;

    public CountAggregator(String valueColumn) {
        this.valueColumn = valueColumn;
    }

    @Override
    public SeriesValues<Long> aggregate(Partition partition, CancellationSignal signal) {
        Iterator<Sample> it = partition.readValues(valueColumn);
        long count = 0;
        long timestamp = 0;
        while (it.hasNext()) {
            signal.checkCancelled();
            Sample s = it.next();
            if (!Double.isNaN(s.value)) {
                timestamp = count == 0 ? s.timestamp : Math.max(timestamp, s.timestamp);
                count++;
            }
        }
        return SeriesValues.single(partition.seriesKey(), timestamp, count);
    }
}
