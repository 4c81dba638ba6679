package io.chronr.query.func;

import io.chronr.segment.ColumnSchema;
import io.chronr.segment.DatasetSchema;

/**
 * How a positional function argument is parsed.
 */
public enum ArgType {
    TIMESTAMP_COLUMN("timestamp-column") {
        @Override
        Object parse(String raw, DatasetSchema schema) {
            ColumnSchema cs = column(raw, schema);
            if (!cs.type.isIntegral()) {
                throw new IllegalArgumentException("not a TIMESTAMP or LONG column");
            }
            return cs.name;
        }
    },
    VALUE_COLUMN("value-column") {
        @Override
        Object parse(String raw, DatasetSchema schema) {
            ColumnSchema cs = column(raw, schema);
            if (!cs.type.isNumber()) {
                throw new IllegalArgumentException("not a numeric column");
            }
            return cs.name;
        }
    },
    DOUBLE("double") {
        @Override
        Object parse(String raw, DatasetSchema schema) {
            double v;
            try {
                v = Double.parseDouble(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a double");
            }
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                throw new IllegalArgumentException("not a finite double");
            }
            return v;
        }
    },
    INTEGER("integer") {
        @Override
        Object parse(String raw, DatasetSchema schema) {
            try {
                return Integer.parseInt(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not an integer");
            }
        }
    },
    LONG("long") {
        @Override
        Object parse(String raw, DatasetSchema schema) {
            try {
                return Long.parseLong(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("not a long");
            }
        }
    },
    //
    ;

    public final String label;

    ArgType(String label) {
        this.label = label;
    }

    /**
     * @throws IllegalArgumentException with the reason as message if <code>raw</code> is not acceptable.
     */
    abstract Object parse(String raw, DatasetSchema schema);

    private static ColumnSchema column(String raw, DatasetSchema schema) {
        ColumnSchema cs = schema.column(raw);
        if (cs == null) {
            throw new IllegalArgumentException("no such column in " + schema.ref);
        }
        if (cs.name.equals(schema.partitionColumn)) {
            throw new IllegalArgumentException("partition column can not be aggregated");
        }
        return cs;
    }
}
