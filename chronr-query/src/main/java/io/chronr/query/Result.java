package io.chronr.query;

import com.google.common.base.Preconditions;

import java.util.function.Function;

/**
 * Either a value or exactly one {@link QueryError}.
 */
public final class Result<T> {
    private final T value;
    private final QueryError error;

    private Result(T value, QueryError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> good(T value) {
        return new Result<>(Preconditions.checkNotNull(value), null);
    }

    public static <T> Result<T> bad(QueryError error) {
        return new Result<>(null, Preconditions.checkNotNull(error));
    }

    public boolean isGood() {
        return error == null;
    }

    public boolean isBad() {
        return error != null;
    }

    public T get() {
        if (error != null) {
            throw new IllegalStateException("Bad result: " + error);
        }
        return value;
    }

    public QueryError error() {
        if (error == null) {
            throw new IllegalStateException("Good result has no error");
        }
        return error;
    }

    public <R> Result<R> map(Function<? super T, ? extends R> f) {
        return isGood() ? Result.good(f.apply(value)) : Result.bad(error);
    }

    public <R> Result<R> flatMap(Function<? super T, Result<R>> f) {
        return isGood() ? f.apply(value) : Result.bad(error);
    }

    @Override
    public String toString() {
        return isGood() ? "Good(" + value + ")" : "Bad(" + error + ")";
    }
}
