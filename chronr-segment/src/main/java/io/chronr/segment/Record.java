package io.chronr.segment;

import java.util.Arrays;

/**
 * One ingested row. Values are positional, in the order of {@link DatasetSchema#columns}.
 */
public class Record {
    private final Object[] values;

    public Record(Object... values) {
        this.values = values;
    }

    public static Record of(Object... values) {
        return new Record(values);
    }

    public int size() {
        return values.length;
    }

    public Object get(int colId) {
        return values[colId];
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
