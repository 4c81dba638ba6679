package io.chronr.segment.mem;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;

import io.chronr.segment.ColumnReadException;
import io.chronr.segment.ColumnSchema;
import io.chronr.segment.DatasetRef;
import io.chronr.segment.DatasetSchema;
import io.chronr.segment.Partition;
import io.chronr.segment.Record;
import io.chronr.segment.Sample;

/**
 * An append only, column oriented in-memory partition.
 * 
 * Rows are only appended and array slots below the row count are never rewritten, so a reader
 * which captured the arrays and the row count under the lock can iterate without locking.
 */
class TimeSeriesPartition implements Partition {
    private static final int INIT_CAPACITY = 16;

    private final DatasetSchema schema;
    private final int shard;
    private final int ordinal;
    private final String seriesKey;

    // Exactly one of them is non-null for each data column, none for the partition column.
    private final long[][] longs;
    private final double[][] doubles;
    private final String[][] strings;

    private int rowCount;

    TimeSeriesPartition(DatasetSchema schema, int shard, int ordinal, String seriesKey) {
        this.schema = schema;
        this.shard = shard;
        this.ordinal = ordinal;
        this.seriesKey = seriesKey;

        int colCount = schema.columns.size();
        this.longs = new long[colCount][];
        this.doubles = new double[colCount][];
        this.strings = new String[colCount][];
        for (int colId = 0; colId < colCount; colId++) {
            ColumnSchema cs = schema.columns.get(colId);
            if (cs.name.equals(schema.partitionColumn)) {
                continue;
            }
            switch (cs.type) {
                case TIMESTAMP:
                case LONG:
                    longs[colId] = new long[INIT_CAPACITY];
                    break;
                case DOUBLE:
                    doubles[colId] = new double[INIT_CAPACITY];
                    break;
                case STRING:
                    strings[colId] = new String[INIT_CAPACITY];
                    break;
                default:
                    throw new IllegalStateException("Illegal type: " + cs.type);
            }
        }
    }

    int ordinal() {
        return ordinal;
    }

    @Override
    public DatasetRef dataset() {
        return schema.ref;
    }

    @Override
    public int shard() {
        return shard;
    }

    @Override
    public String seriesKey() {
        return seriesKey;
    }

    @Override
    public synchronized int rowCount() {
        return rowCount;
    }

    /**
     * The record must already be checked by {@link #convert}.
     */
    synchronized void append(Object[] converted) {
        ensureCapacity(rowCount + 1);
        for (int colId = 0; colId < converted.length; colId++) {
            if (longs[colId] != null) {
                longs[colId][rowCount] = (Long) converted[colId];
            } else if (doubles[colId] != null) {
                doubles[colId][rowCount] = (Double) converted[colId];
            } else if (strings[colId] != null) {
                strings[colId][rowCount] = (String) converted[colId];
            }
        }
        rowCount++;
    }

    private void ensureCapacity(int size) {
        for (int colId = 0; colId < longs.length; colId++) {
            if (longs[colId] != null && longs[colId].length < size) {
                longs[colId] = Arrays.copyOf(longs[colId], longs[colId].length << 1);
            } else if (doubles[colId] != null && doubles[colId].length < size) {
                doubles[colId] = Arrays.copyOf(doubles[colId], doubles[colId].length << 1);
            } else if (strings[colId] != null && strings[colId].length < size) {
                strings[colId] = Arrays.copyOf(strings[colId], strings[colId].length << 1);
            }
        }
    }

    /**
     * Convert the values of a record into the storage form of each column, or throw
     * {@link IllegalArgumentException} without touching anything.
     */
    static Object[] convert(DatasetSchema schema, Record record) {
        if (record.size() != schema.columns.size()) {
            throw new IllegalArgumentException(String.format(
                    "Record has %d values, expected %d: %s", record.size(), schema.columns.size(), record));
        }
        Object[] converted = new Object[record.size()];
        for (int colId = 0; colId < converted.length; colId++) {
            ColumnSchema cs = schema.columns.get(colId);
            Object v = record.get(colId);
            switch (cs.type) {
                case TIMESTAMP:
                case LONG:
                    if (!(v instanceof Number)) {
                        throw new IllegalArgumentException(String.format(
                                "Illegal value of column [%s]: %s", cs.name, v));
                    }
                    converted[colId] = ((Number) v).longValue();
                    break;
                case DOUBLE:
                    if (v == null) {
                        converted[colId] = Double.NaN;
                    } else if (v instanceof Number) {
                        converted[colId] = ((Number) v).doubleValue();
                    } else {
                        throw new IllegalArgumentException(String.format(
                                "Illegal value of column [%s]: %s", cs.name, v));
                    }
                    break;
                case STRING:
                    if (v == null && cs.name.equals(schema.partitionColumn)) {
                        throw new IllegalArgumentException("Partition key is null: " + record);
                    }
                    converted[colId] = v == null ? null : v.toString();
                    break;
                default:
                    throw new IllegalStateException("Illegal type: " + cs.type);
            }
        }
        return converted;
    }

    @Override
    public Iterator<Sample> readValues(String valueColumn) {
        return readValues(schema.timestampColumn, valueColumn);
    }

    @Override
    public Iterator<Sample> readValues(String timestampColumn, String valueColumn) {
        int tsColId = schema.columnIndex(timestampColumn);
        int valColId = schema.columnIndex(valueColumn);
        if (tsColId < 0 || longs[tsColId] == null) {
            throw new ColumnReadException(String.format(
                    "Column [%s] of [%s] is not a readable timestamp column", timestampColumn, seriesKey));
        }
        if (valColId < 0 || (longs[valColId] == null && doubles[valColId] == null)) {
            throw new ColumnReadException(String.format(
                    "Column [%s] of [%s] is not a readable numeric column", valueColumn, seriesKey));
        }

        long[] tsData;
        long[] longData;
        double[] doubleData;
        int count;
        synchronized (this) {
            tsData = longs[tsColId];
            longData = longs[valColId];
            doubleData = doubles[valColId];
            count = rowCount;
        }
        return new Iterator<Sample>() {
            int rowId = 0;

            @Override
            public boolean hasNext() {
                return rowId < count;
            }

            @Override
            public Sample next() {
                if (rowId >= count) {
                    throw new NoSuchElementException();
                }
                double value = doubleData != null ? doubleData[rowId] : (double) longData[rowId];
                Sample sample = new Sample(tsData[rowId], value);
                rowId++;
                return sample;
            }
        };
    }

    @Override
    public String toString() {
        return "TimeSeriesPartition{" +
                "dataset=" + schema.ref +
                ", shard=" + shard +
                ", seriesKey='" + seriesKey + '\'' +
                ", rowCount=" + rowCount() +
                '}';
    }
}
