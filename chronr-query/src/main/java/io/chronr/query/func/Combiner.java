package io.chronr.query.func;

import io.chronr.query.result.Aggregate;
import io.chronr.query.result.SeriesValues;

/**
 * Folds per partition results into one {@link Aggregate}.
 * 
 * Partitions complete in no particular order, so the fold must be commutative and associative:
 * any order of {@link Accumulator#add} calls, and any grouping of them by {@link Accumulator#merge},
 * gives the same result.
 */
public interface Combiner {

    Accumulator newAccumulator();

    /**
     * The running state of one fold. Not thread safe, one thread updates it at a time.
     */
    interface Accumulator {
        void add(SeriesValues<?> values);

        /**
         * Fold the state of <code>other</code>, created by the same combiner, into this one.
         */
        void merge(Accumulator other);

        Aggregate result();
    }
}
