package io.chronr.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

/**
 * A parallelizable share of the partitions of a shard.
 * Split <code>index</code> of <code>count</code> holds the partitions whose ordinal modulo <code>count</code> is <code>index</code>.
 */
public class ScanSplit {
    public static final ScanSplit ALL = new ScanSplit(0, 1);

    protected final int index;
    protected final int count;

    @JsonCreator
    public ScanSplit(@JsonProperty("index") int index,
                     @JsonProperty("count") int count) {
        Preconditions.checkArgument(count > 0, "split count must be positive");
        Preconditions.checkArgument(index >= 0 && index < count, "split index out of range");
        this.index = index;
        this.count = count;
    }

    @JsonProperty("index")
    public int index() {
        return index;
    }

    @JsonProperty("count")
    public int count() {
        return count;
    }

    public boolean contains(int partitionOrdinal) {
        return partitionOrdinal % count == index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScanSplit split = (ScanSplit) o;
        return index == split.index && count == split.count;
    }

    @Override
    public int hashCode() {
        return index * 31 + count;
    }

    @Override
    public String toString() {
        return "ScanSplit{" +
                "index=" + index +
                ", count=" + count +
                '}';
    }
}
