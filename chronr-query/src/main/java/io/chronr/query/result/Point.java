package io.chronr.query.result;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public class Point<T> {
    @JsonProperty("timestamp")
    public final long timestamp;
    @JsonProperty("value")
    public final T value;

    public Point(long timestamp, T value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    public static <T> Point<T> of(long timestamp, T value) {
        return new Point<>(timestamp, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Point<?> point = (Point<?>) o;
        return timestamp == point.timestamp && Objects.equals(value, point.value);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(timestamp) * 31 + Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return "(" + timestamp + ", " + value + ")";
    }
}
