package io.chronr.segment.mem;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.chronr.segment.DatasetSchema;
import io.chronr.segment.Record;

/**
 * The partitions of one shard of a dataset, in the order they were first seen.
 */
class TimeSeriesShard {
    private final DatasetSchema schema;
    private final int shard;
    private final int partitionColId;

    private final List<TimeSeriesPartition> partitions = new ArrayList<>();
    private final Map<String, TimeSeriesPartition> keyToPartition = new HashMap<>();

    TimeSeriesShard(DatasetSchema schema, int shard) {
        this.schema = schema;
        this.shard = shard;
        this.partitionColId = schema.columnIndex(schema.partitionColumn);
    }

    DatasetSchema schema() {
        return schema;
    }

    int shard() {
        return shard;
    }

    /**
     * @return the number of records ingested.
     */
    synchronized int ingest(List<Record> records) {
        // Convert all first, so that a bad record leaves the shard untouched.
        List<Object[]> rows = new ArrayList<>(records.size());
        for (Record record : records) {
            rows.add(TimeSeriesPartition.convert(schema, record));
        }
        for (Object[] row : rows) {
            String key = (String) row[partitionColId];
            TimeSeriesPartition partition = keyToPartition.get(key);
            if (partition == null) {
                partition = new TimeSeriesPartition(schema, shard, partitions.size(), key);
                partitions.add(partition);
                keyToPartition.put(key, partition);
            }
            partition.append(row);
        }
        return rows.size();
    }

    synchronized List<TimeSeriesPartition> snapshot() {
        return new ArrayList<>(partitions);
    }

    synchronized int partitionCount() {
        return partitions.size();
    }
}
