package io.chronr.query.func;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Function arguments after parsing, next to the raw strings they came from.
 * Optional arguments not given are absent, check with {@link #has(int)}.
 */
public class ParsedArgs {
    private final List<String> raw;
    private final List<Object> values;

    ParsedArgs(List<String> raw, List<Object> values) {
        this.raw = ImmutableList.copyOf(raw);
        this.values = ImmutableList.copyOf(values);
    }

    public int size() {
        return values.size();
    }

    public boolean has(int index) {
        return index < values.size();
    }

    public String raw(int index) {
        return raw.get(index);
    }

    public String getString(int index) {
        return (String) values.get(index);
    }

    public double getDouble(int index) {
        return (Double) values.get(index);
    }

    public int getInt(int index) {
        return (Integer) values.get(index);
    }

    public int getInt(int index, int defaultValue) {
        return has(index) ? getInt(index) : defaultValue;
    }

    public long getLong(int index) {
        return (Long) values.get(index);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
