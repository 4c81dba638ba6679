package io.chronr.query.result;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * The result of aggregating one partition: the series key and the points computed from it.
 */
public class SeriesValues<T> {
    @JsonProperty("series")
    public final String seriesKey;
    @JsonProperty("points")
    public final List<Point<T>> points;

    public SeriesValues(String seriesKey, List<Point<T>> points) {
        this.seriesKey = Preconditions.checkNotNull(seriesKey);
        this.points = ImmutableList.copyOf(points);
    }

    public static <T> SeriesValues<T> empty(String seriesKey) {
        return new SeriesValues<>(seriesKey, ImmutableList.of());
    }

    public static <T> SeriesValues<T> single(String seriesKey, long timestamp, T value) {
        return new SeriesValues<>(seriesKey, ImmutableList.of(Point.of(timestamp, value)));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return points.isEmpty();
    }

    public int size() {
        return points.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SeriesValues<?> that = (SeriesValues<?>) o;
        return seriesKey.equals(that.seriesKey) && points.equals(that.points);
    }

    @Override
    public int hashCode() {
        return seriesKey.hashCode() * 31 + points.hashCode();
    }

    @Override
    public String toString() {
        return "SeriesValues{" +
                "series='" + seriesKey + '\'' +
                ", points=" + points +
                '}';
    }
}
