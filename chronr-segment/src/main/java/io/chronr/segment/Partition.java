package io.chronr.segment;

import java.util.Iterator;

/**
 * The stored samples of one series in one shard.
 * 
 * Readers are lazy and see the rows present when the reader was created. Reading may throw
 * {@link ColumnReadException} at any point of the iteration.
 */
public interface Partition {
    DatasetRef dataset();

    int shard();

    /**
     * The value of the partition column shared by all rows of this partition.
     */
    String seriesKey();

    int rowCount();

    /**
     * Read a numeric column, paired with the dataset's timestamp column.
     */
    Iterator<Sample> readValues(String valueColumn);

    /**
     * Read a numeric column, paired with the given integral column as timestamp.
     */
    Iterator<Sample> readValues(String timestampColumn, String valueColumn);
}
