package io.chronr.query;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared by all the tasks of one query. Cancelling is cooperative: tasks poll it and stop.
 */
public class CancellationSignal {
    private final AtomicReference<String> reason = new AtomicReference<>();

    /**
     * @return true if this call did the cancellation.
     */
    public boolean cancel(String why) {
        return reason.compareAndSet(null, why == null ? "cancelled" : why);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    public void checkCancelled() {
        String why = reason.get();
        if (why != null) {
            throw new CancellationException(why);
        }
    }
}
