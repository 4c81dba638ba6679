package io.chronr.query.func;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import io.chronr.query.result.Aggregate;
import io.chronr.query.result.ListAggregate;
import io.chronr.query.result.SeriesValues;

/**
 * Keeps every series' result. The list is sorted by series key when the fold completes,
 * so it does not depend on the arrival order.
 */
public class ListCombiner implements Combiner {
    private static final Comparator<SeriesValues<?>> bySeriesKey = Comparator.comparing(sv -> sv.seriesKey);

    @Override
    public Accumulator newAccumulator() {
        return new ListAccumulator();
    }

    static class ListAccumulator implements Accumulator {
        private final List<SeriesValues<?>> values = new ArrayList<>();

        @Override
        public void add(SeriesValues<?> sv) {
            values.add(sv);
        }

        @Override
        public void merge(Accumulator other) {
            values.addAll(((ListAccumulator) other).values);
        }

        @Override
        @SuppressWarnings("unchecked")
        public Aggregate result() {
            List<SeriesValues<Object>> sorted = new ArrayList<>(values.size());
            for (SeriesValues<?> sv : values) {
                sorted.add((SeriesValues<Object>) sv);
            }
            sorted.sort(bySeriesKey);
            return new ListAggregate<>(sorted);
        }
    }
}
