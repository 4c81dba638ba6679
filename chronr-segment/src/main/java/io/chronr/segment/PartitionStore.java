package io.chronr.segment;

import java.util.Iterator;
import java.util.List;

/**
 * Where partitions live. The query side only ever calls {@link #scanPartitions}.
 */
public interface PartitionStore {

    /**
     * Prepare <code>shard</code> of the dataset to accept records. Calling it again is a no-op,
     * unless the schema differs, which is an error.
     */
    void setup(DatasetSchema schema, int shard);

    /**
     * Append records into the shard. Records are routed to partitions by the partition column.
     */
    void ingest(DatasetRef dataset, int shard, List<Record> records);

    /**
     * Split the partitions of every shard of the dataset into at most <code>desiredParallelism</code> splits.
     */
    List<ScanSplit> getScanSplits(DatasetRef dataset, int desiredParallelism);

    /**
     * A lazy, finite iterator over the partitions of the shard selected by <code>scan</code>.
     */
    Iterator<Partition> scanPartitions(DatasetRef dataset, int shard, PartitionScan scan);

    /**
     * Drop everything.
     */
    void reset();
}
