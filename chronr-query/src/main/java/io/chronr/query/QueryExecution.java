package io.chronr.query;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import io.chronr.query.func.Aggregator;
import io.chronr.query.func.Combiner.Accumulator;
import io.chronr.query.result.Aggregate;
import io.chronr.query.result.SeriesValues;
import io.chronr.segment.DatasetSchema;
import io.chronr.segment.Partition;
import io.chronr.segment.PartitionScan;
import io.chronr.segment.PartitionStore;

/**
 * One run of a query. Created by {@link QueryEngine#execute}.
 * 
 * Each scan is folded by its own driver on the dispatch pool: the driver pulls partitions from the
 * store, keeps at most <code>maxInFlight</code> of them aggregating on the worker pool, and adds
 * results to its accumulator as they complete. Once every driver is done their accumulators are
 * merged in scan order. The first fault fails the query, cancels everything still running and drops
 * all partial accumulators.
 */
public class QueryExecution {
    private static final Logger logger = LoggerFactory.getLogger(QueryExecution.class);
    private static final AtomicLong idGen = new AtomicLong(0);

    private final long id = idGen.incrementAndGet();
    private final DatasetSchema schema;
    private final int shard;
    private final QuerySpec spec;
    private final List<PartitionScan> scans;

    private final CancellationSignal signal = new CancellationSignal();
    private final AtomicReference<QueryState> state = new AtomicReference<>(QueryState.RECEIVED);
    private final CompletableFuture<Result<Aggregate>> future = new CompletableFuture<>();
    private final long createTime = System.currentTimeMillis();

    private volatile ExecutionPlan plan;

    QueryExecution(DatasetSchema schema, int shard, QuerySpec spec, List<PartitionScan> scans) {
        this.schema = schema;
        this.shard = shard;
        this.spec = spec;
        this.scans = ImmutableList.copyOf(scans);
    }

    public long id() {
        return id;
    }

    public QueryState state() {
        return state.get();
    }

    /**
     * Null until validation passed.
     */
    public ExecutionPlan plan() {
        return plan;
    }

    /**
     * Completes with the aggregate or the error, never exceptionally.
     */
    public CompletableFuture<Result<Aggregate>> future() {
        return future;
    }

    /**
     * Stop the query. Tasks past their last cancellation check finish, but their results are dropped.
     *
     * @return false if the query was already done.
     */
    public boolean cancel() {
        return abort("Query cancelled");
    }

    /**
     * Fail with <code>why</code> and stop everything still running.
     *
     * @return false if the query was already done.
     */
    boolean abort(String why) {
        boolean aborted = finish(Result.bad(new RuntimeFault(why, null)));
        signal.cancel(why);
        if (aborted) {
            logger.info("Query aborted. [query: {}, dataset: {}, reason: {}]", id, schema.ref, why);
        }
        return aborted;
    }

    /**
     * Validate on the caller's thread.
     *
     * @return false if validation failed, and this execution is done.
     */
    boolean validate() {
        state.compareAndSet(QueryState.RECEIVED, QueryState.VALIDATING);
        Result<ExecutionPlan> res = QueryValidator.validate(schema, spec);
        if (res.isBad()) {
            finish(Result.bad(res.error()));
            return false;
        }
        plan = res.get();
        state.compareAndSet(QueryState.VALIDATING, QueryState.SCHEDULED);
        return true;
    }

    void run(PartitionStore store, ExecutorService dispatchPool, ExecutorService workerPool, int maxInFlight) {
        logger.debug("Query scheduled. [query: {}, plan: {}, scans: {}]", id, plan, scans.size());

        List<CompletableFuture<Accumulator>> folds = new ArrayList<>(scans.size());
        for (PartitionScan scan : scans) {
            CompletableFuture<Accumulator> fold;
            try {
                fold = CompletableFuture.supplyAsync(() -> foldScan(store, scan, workerPool, maxInFlight), dispatchPool);
            } catch (RejectedExecutionException e) {
                fail(e);
                return;
            }
            // Fail fast, don't wait for the other scans.
            fold.whenComplete((acc, t) -> {
                if (t != null) {
                    fail(t);
                }
            });
            folds.add(fold);
        }

        CompletableFuture.allOf(folds.toArray(new CompletableFuture[0]))
                .thenRun(() -> {
                    Accumulator total = plan.combiner.newAccumulator();
                    for (CompletableFuture<Accumulator> fold : folds) {
                        total.merge(fold.join());
                    }
                    complete(total.result());
                })
                .exceptionally(t -> {
                    fail(t);
                    return null;
                });
    }

    private Accumulator foldScan(PartitionStore store, PartitionScan scan, ExecutorService workerPool, int maxInFlight) {
        state.compareAndSet(QueryState.SCHEDULED, QueryState.RUNNING);
        signal.checkCancelled();

        Aggregator<?> aggregator = plan.aggregator;
        Accumulator acc = plan.combiner.newAccumulator();
        CompletionService<SeriesValues<?>> completion = new ExecutorCompletionService<>(workerPool);
        Set<Future<SeriesValues<?>>> inFlight = new HashSet<>();
        try {
            Iterator<Partition> partitions = store.scanPartitions(schema.ref, shard, scan);
            while (true) {
                while (inFlight.size() < maxInFlight && !signal.isCancelled() && partitions.hasNext()) {
                    Partition partition = partitions.next();
                    inFlight.add(completion.submit(() -> aggregator.aggregate(partition, signal)));
                }
                if (inFlight.isEmpty()) {
                    break;
                }
                Future<SeriesValues<?>> done = completion.take();
                inFlight.remove(done);
                acc.add(done.get());
                signal.checkCancelled();
            }
            signal.checkCancelled();
            return acc;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CompletionException(e);
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        } finally {
            for (Future<?> f : inFlight) {
                f.cancel(true);
            }
        }
    }

    private void complete(Aggregate aggregate) {
        if (finish(Result.good(aggregate))) {
            logger.debug("Query completed. [query: {}, cost: {}ms]", id, System.currentTimeMillis() - createTime);
        }
    }

    private void fail(Throwable t) {
        RuntimeFault fault = RuntimeFault.of(t);
        boolean failed = finish(Result.bad(fault));
        // Only after the outcome is fixed, so that sibling cancellations can not take its place.
        signal.cancel(fault.detail);
        if (failed) {
            logger.warn("Query failed. [query: {}, dataset: {}, fault: {}]", id, schema.ref, fault.detail, fault.cause);
        }
    }

    /**
     * Fix the outcome. Only the first call counts.
     */
    private synchronized boolean finish(Result<Aggregate> result) {
        if (state.get().isDone()) {
            return false;
        }
        state.set(result.isGood() ? QueryState.COMPLETED : QueryState.FAILED);
        future.complete(result);
        return true;
    }

    @Override
    public String toString() {
        return "QueryExecution{" +
                "id=" + id +
                ", dataset=" + schema.ref +
                ", shard=" + shard +
                ", spec=" + spec +
                ", state=" + state.get() +
                '}';
    }
}
