package io.chronr.segment;

/**
 * A (timestamp, value) pair read from one column of a partition.
 */
public class Sample {
    public final long timestamp;
    public final double value;

    public Sample(long timestamp, double value) {
        this.timestamp = timestamp;
        this.value = value;
    }

    @Override
    public String toString() {
        return "Sample{" +
                "timestamp=" + timestamp +
                ", value=" + value +
                '}';
    }
}
