package io.chronr.query;

import java.util.Objects;

/**
 * Unknown function name, or an aggregation function a combiner can not consume.
 */
public final class InvalidAggregator extends QueryError {
    public final String detail;

    public InvalidAggregator(String detail) {
        this.detail = detail;
    }

    @Override
    public String message() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(detail, ((InvalidAggregator) o).detail);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(detail);
    }
}
