package io.chronr.query;

import java.util.Objects;

/**
 * An argument could not be parsed as its declared type, or its value is not acceptable.
 */
public final class BadArgument extends QueryError {
    public final String function;
    public final int index;
    public final String rawValue;
    public final String reason;

    public BadArgument(String function, int index, String rawValue, String reason) {
        this.function = function;
        this.index = index;
        this.rawValue = rawValue;
        this.reason = reason;
    }

    @Override
    public String message() {
        return String.format("%s argument %d [%s]: %s", function, index, rawValue, reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BadArgument that = (BadArgument) o;
        return index == that.index
                && Objects.equals(function, that.function)
                && Objects.equals(rawValue, that.rawValue)
                && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, index, rawValue, reason);
    }
}
