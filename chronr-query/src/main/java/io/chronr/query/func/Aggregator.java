package io.chronr.query.func;

import io.chronr.query.CancellationSignal;
import io.chronr.query.result.SeriesValues;
import io.chronr.segment.Partition;

/**
 * Reduces one partition into a {@link SeriesValues}.
 * 
 * Implementations hold only their parsed arguments, so one instance is shared by all the
 * partition tasks of a query. They must poll <code>signal</code> while reading and give up once it is cancelled.
 * NaN values are missing values and are skipped.
 */
public interface Aggregator<T> {
    SeriesValues<T> aggregate(Partition partition, CancellationSignal signal);
}
