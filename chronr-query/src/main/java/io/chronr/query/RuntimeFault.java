package io.chronr.query;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * The query failed while running, e.g. a partition held malformed data. The whole query fails with it.
 */
public final class RuntimeFault extends QueryError {
    public final String detail;
    public final Throwable cause;

    public RuntimeFault(String detail, Throwable cause) {
        this.detail = detail;
        this.cause = cause;
    }

    public static RuntimeFault of(Throwable t) {
        Throwable cause = unwrap(t);
        String msg = cause.getMessage();
        return new RuntimeFault(
                msg == null ? cause.getClass().getSimpleName() : cause.getClass().getSimpleName() + ": " + msg,
                cause);
    }

    static Throwable unwrap(Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    @Override
    public String message() {
        return detail;
    }

    @Override
    public boolean isValidationError() {
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(detail, ((RuntimeFault) o).detail);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(detail);
    }
}
