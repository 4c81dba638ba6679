package io.chronr.segment;

import com.google.common.base.Preconditions;

import java.util.function.Predicate;

/**
 * What to scan: a split, optionally narrowed by a filter on series keys.
 */
public class PartitionScan {
    public final ScanSplit split;
    public final Predicate<String> keyFilter;

    private PartitionScan(ScanSplit split, Predicate<String> keyFilter) {
        this.split = Preconditions.checkNotNull(split);
        this.keyFilter = Preconditions.checkNotNull(keyFilter);
    }

    public static PartitionScan of(ScanSplit split) {
        return new PartitionScan(split, key -> true);
    }

    public static PartitionScan filtered(ScanSplit split, Predicate<String> keyFilter) {
        return new PartitionScan(split, keyFilter);
    }

    public boolean accept(int partitionOrdinal, String seriesKey) {
        return split.contains(partitionOrdinal) && keyFilter.test(seriesKey);
    }

    @Override
    public String toString() {
        return "PartitionScan{" + "split=" + split + '}';
    }
}
