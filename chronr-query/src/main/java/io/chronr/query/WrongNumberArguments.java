package io.chronr.query;

/**
 * The argument count is out of the function's bounds. <code>expected</code> is the least number of
 * arguments the function takes.
 */
public final class WrongNumberArguments extends QueryError {
    public final int given;
    public final int expected;

    public WrongNumberArguments(int given, int expected) {
        this.given = given;
        this.expected = expected;
    }

    @Override
    public String message() {
        return String.format("given %d arguments, expected %d", given, expected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WrongNumberArguments that = (WrongNumberArguments) o;
        return given == that.given && expected == that.expected;
    }

    @Override
    public int hashCode() {
        return given * 31 + expected;
    }
}
