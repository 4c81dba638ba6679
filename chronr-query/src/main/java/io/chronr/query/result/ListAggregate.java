package io.chronr.query.result;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Every series' own result, ordered by series key.
 */
public class ListAggregate<T> extends Aggregate {
    @JsonProperty("values")
    public final List<SeriesValues<T>> values;

    public ListAggregate(List<SeriesValues<T>> values) {
        this.values = ImmutableList.copyOf(values);
    }

    @Override
    public Kind kind() {
        return Kind.LIST;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((ListAggregate<?>) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }
}
