package io.chronr.segment.mem;

import com.google.common.base.Preconditions;
import com.google.common.collect.Iterators;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import io.chronr.segment.DatasetRef;
import io.chronr.segment.DatasetSchema;
import io.chronr.segment.Partition;
import io.chronr.segment.PartitionScan;
import io.chronr.segment.PartitionStore;
import io.chronr.segment.Record;
import io.chronr.segment.ScanSplit;

/**
 * A {@link PartitionStore} holding everything on heap. Meant for realtime data and tests.
 */
public class TimeSeriesMemStore implements PartitionStore {
    private static final Logger logger = LoggerFactory.getLogger(TimeSeriesMemStore.class);

    private final Map<DatasetRef, Map<Integer, TimeSeriesShard>> datasets = new ConcurrentHashMap<>();

    @Override
    public void setup(DatasetSchema schema, int shard) {
        Preconditions.checkNotNull(schema);
        Preconditions.checkArgument(shard >= 0, "shard must not be negative");

        Map<Integer, TimeSeriesShard> shards = datasets.computeIfAbsent(schema.ref, ref -> new ConcurrentHashMap<>());
        TimeSeriesShard old = shards.putIfAbsent(shard, new TimeSeriesShard(schema, shard));
        if (old == null) {
            logger.info("Setup dataset shard. [dataset: {}, shard: {}]", schema.ref, shard);
        } else if (!old.schema().equals(schema)) {
            throw new IllegalStateException(String.format(
                    "Shard %d of dataset %s already set up with another schema", shard, schema.ref));
        }
    }

    @Override
    public void ingest(DatasetRef dataset, int shard, List<Record> records) {
        int count = getShard(dataset, shard).ingest(records);
        logger.debug("Ingested records. [dataset: {}, shard: {}, count: {}]", dataset, shard, count);
    }

    @Override
    public List<ScanSplit> getScanSplits(DatasetRef dataset, int desiredParallelism) {
        if (!datasets.containsKey(dataset)) {
            throw new IllegalArgumentException("Unknown dataset: " + dataset);
        }
        int count = Math.max(desiredParallelism, 1);
        List<ScanSplit> splits = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            splits.add(new ScanSplit(i, count));
        }
        return splits;
    }

    @Override
    public Iterator<Partition> scanPartitions(DatasetRef dataset, int shard, PartitionScan scan) {
        Preconditions.checkNotNull(scan);
        Iterator<TimeSeriesPartition> it = Iterators.filter(
                getShard(dataset, shard).snapshot().iterator(),
                p -> scan.accept(p.ordinal(), p.seriesKey()));
        return Iterators.transform(it, p -> (Partition) p);
    }

    public int numPartitions(DatasetRef dataset, int shard) {
        return getShard(dataset, shard).partitionCount();
    }

    @Override
    public void reset() {
        datasets.clear();
        logger.info("Memstore reset.");
    }

    private TimeSeriesShard getShard(DatasetRef dataset, int shard) {
        Map<Integer, TimeSeriesShard> shards = datasets.get(dataset);
        TimeSeriesShard s = shards == null ? null : shards.get(shard);
        if (s == null) {
            throw new IllegalStateException(String.format("Shard %d of dataset %s is not set up", shard, dataset));
        }
        return s;
    }
}
