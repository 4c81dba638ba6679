package io.chronr.query;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import io.chronr.query.result.Aggregate;
import io.chronr.segment.DatasetSchema;
import io.chronr.segment.PartitionScan;
import io.chronr.segment.PartitionStore;
import io.chronr.segment.ScanSplit;
import io.chronr.util.Try;

/**
 * Where queries come in.
 * 
 * A query is validated on the caller's thread; an invalid one is answered right away and nothing
 * is scheduled. A valid one runs on the engine's thread pools and is answered asynchronously.
 * Timeouts are up to the caller, e.g. {@link CompletableFuture#get(long, TimeUnit)} followed by
 * {@link QueryExecution#cancel()}.
 */
public class QueryEngine implements Closeable {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);
    private static final String CLOSED = "Query engine is closed";

    private final PartitionStore store;
    private final QueryConfig config;
    private final ExecutorService dispatchPool;
    private final ExecutorService workerPool;
    // Queries scheduled and not done yet.
    private final Set<QueryExecution> running = ConcurrentHashMap.newKeySet();

    private volatile boolean closed = false;

    public QueryEngine(PartitionStore store, QueryConfig config) {
        this.store = Preconditions.checkNotNull(store);
        this.config = Preconditions.checkNotNull(config);
        this.dispatchPool = Executors.newFixedThreadPool(config.getDispatchThreads(), daemonThreads("Chronr-Query-Dispatch-"));
        this.workerPool = Executors.newFixedThreadPool(config.getWorkerThreads(), daemonThreads("Chronr-Query-Worker-"));

        logger.info("Query engine started. [config: {}]", config);
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger id = new AtomicInteger(0);
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + id.getAndIncrement());
            t.setDaemon(true);
            if (t.getPriority() != Thread.NORM_PRIORITY)
                t.setPriority(Thread.NORM_PRIORITY);
            return t;
        };
    }

    public Result<ExecutionPlan> validate(DatasetSchema schema, QuerySpec spec) {
        return QueryValidator.validate(schema, spec);
    }

    /**
     * Run a query over the partitions of <code>shard</code> selected by <code>scans</code>.
     */
    public QueryExecution execute(DatasetSchema schema, int shard, QuerySpec spec, List<PartitionScan> scans) {
        Preconditions.checkNotNull(schema);
        Preconditions.checkNotNull(spec);
        Preconditions.checkNotNull(scans);

        QueryExecution execution = new QueryExecution(schema, shard, spec, scans);
        if (!execution.validate()) {
            return execution;
        }
        running.add(execution);
        execution.future().whenComplete((r, t) -> running.remove(execution));
        // Checked after registering, so that close() either sees this query or it sees closed.
        if (closed) {
            execution.abort(CLOSED);
            return execution;
        }
        execution.run(store, dispatchPool, workerPool, config.getMaxInFlight());
        return execution;
    }

    public CompletableFuture<Result<Aggregate>> submit(DatasetSchema schema, int shard, QuerySpec spec, PartitionScan... scans) {
        return execute(schema, shard, spec, Arrays.asList(scans)).future();
    }

    public CompletableFuture<Result<Aggregate>> submit(DatasetSchema schema, int shard, QuerySpec spec, ScanSplit split) {
        return submit(schema, shard, spec, PartitionScan.of(split));
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        logger.info("Closing query engine. [running: {}]", running.size());

        // Queued drivers never run after shutdown, their queries must be answered here.
        for (QueryExecution execution : running) {
            execution.abort(CLOSED);
        }
        List<Runnable> dropped = dispatchPool.shutdownNow();
        workerPool.shutdownNow();
        if (!dropped.isEmpty()) {
            logger.debug("Dropped queued scans. [count: {}]", dropped.size());
        }
        Try.on(() -> {
            if (!dispatchPool.awaitTermination(10, TimeUnit.SECONDS)
                    || !workerPool.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Query threads still running after close.");
            }
        }, logger, "Close query engine failed");
    }
}
