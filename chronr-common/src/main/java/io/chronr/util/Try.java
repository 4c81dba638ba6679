package io.chronr.util;

import org.slf4j.Logger;

import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.util.concurrent.CancellationException;

/**
 * Run cleanup style actions whose failure should be logged rather than propagated.
 */
public class Try {

    public static void on(F0 f, Logger logger, String... msg) {
        try {
            f.f();
        } catch (Throwable t) {
            logError(logger, t, msg);
        }
    }

    /**
     * @return the value, or null if it failed.
     */
    public static <T> T on(F1<T> f, Logger logger, String... msg) {
        try {
            return f.f();
        } catch (Throwable t) {
            logError(logger, t, msg);
            return null;
        }
    }

    private static void logError(Logger logger, Throwable t, String... msg) {
        if (logger == null) {
            return;
        }
        String logStr = msg.length > 0 ? msg[0] : "";
        if (isDebugLog(t)) {
            logger.debug(logStr, t);
        } else {
            logger.error(logStr, t);
        }
    }

    static boolean isDebugLog(Throwable t) {
        // Interruption and cancellation are expected when a query is torn down.
        return t instanceof InterruptedIOException
                || t instanceof ClosedByInterruptException
                || t instanceof InterruptedException
                || t instanceof CancellationException;
    }

    @FunctionalInterface
    public interface F0 {
        void f() throws Throwable;
    }

    @FunctionalInterface
    public interface F1<T> {
        T f() throws Throwable;
    }
}
