package io.chronr.query.func;

import java.util.Iterator;

import io.chronr.query.CancellationSignal;
import io.chronr.query.result.SeriesValues;
import io.chronr.segment.Partition;
import io.chronr.segment.Sample;

public class FirstAggregator implements Aggregator<Double> {
    private final String timestampColumn;
    private final String valueColumn;

    public FirstAggregator(String timestampColumn, String valueColumn) {
        this.timestampColumn = timestampColumn;
        this.valueColumn = valueColumn;
    }

    @Override
    public SeriesValues<Double> aggregate(Partition partition, CancellationSignal signal) {
        Iterator<Sample> it = partition.readValues(timestampColumn, valueColumn);
        Sample first = null;
        while (it.hasNext()) {
            signal.checkCancelled();
            Sample s = it.next();
            if (Double.isNaN(s.value)) {
                continue;
            }
            // The earlier row wins ties.
            if (first == null || s.timestamp < first.timestamp) {
                first = s;
            }
        }
        return first == null
                ? SeriesValues.empty(partition.seriesKey())
                : SeriesValues.single(partition.seriesKey(), first.timestamp, first.value);
    }
}
