package io.chronr.query;

import java.io.IOException;
import java.util.Properties;

import io.chronr.util.PropertiesUtils;

/**
 * Settings of the query engine, read from the classpath resource {@value #RESOURCE}.
 * JVM system properties with the same keys take precedence.
 */
public class QueryConfig {
    public static final String RESOURCE = "chronr.properties";
    public static final String PREFIX = "chronr.";

    /** Threads running partition aggregations. */
    public static final String WORKER_THREADS = "chronr.query.worker.threads";
    /** Threads driving scan splits, one split at a time each. */
    public static final String DISPATCH_THREADS = "chronr.query.dispatch.threads";
    /** Max partition tasks one split keeps outstanding. */
    public static final String MAX_IN_FLIGHT = "chronr.query.max.inflight";

    private final int workerThreads;
    private final int dispatchThreads;
    private final int maxInFlight;

    public QueryConfig(Properties properties) {
        this.workerThreads = PropertiesUtils.getInt(properties, WORKER_THREADS, Runtime.getRuntime().availableProcessors());
        this.dispatchThreads = PropertiesUtils.getInt(properties, DISPATCH_THREADS, 2);
        this.maxInFlight = PropertiesUtils.getInt(properties, MAX_IN_FLIGHT, workerThreads * 2);

        check(WORKER_THREADS, workerThreads);
        check(DISPATCH_THREADS, dispatchThreads);
        check(MAX_IN_FLIGHT, maxInFlight);
    }

    public static QueryConfig load() throws IOException {
        return new QueryConfig(PropertiesUtils.overrideBySystem(PropertiesUtils.loadRs(RESOURCE), PREFIX));
    }

    private static void check(String key, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(String.format("[%s] must be positive, got %d", key, value));
        }
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public int getDispatchThreads() {
        return dispatchThreads;
    }

    public int getMaxInFlight() {
        return maxInFlight;
    }

    @Override
    public String toString() {
        return "QueryConfig{" +
                "workerThreads=" + workerThreads +
                ", dispatchThreads=" + dispatchThreads +
                ", maxInFlight=" + maxInFlight +
                '}';
    }
}
