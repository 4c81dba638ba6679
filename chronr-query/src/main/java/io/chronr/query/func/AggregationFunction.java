package io.chronr.query.func;

import io.chronr.query.BadArgument;

import static io.chronr.query.func.ArgType.INTEGER;
import static io.chronr.query.func.ArgType.LONG;
import static io.chronr.query.func.ArgType.TIMESTAMP_COLUMN;
import static io.chronr.query.func.ArgType.VALUE_COLUMN;
import static io.chronr.query.func.OutputShape.MULTI_POINT;
import static io.chronr.query.func.OutputShape.SINGLE_SCALAR;

/**
 * The per partition reductions a query can use.
 */
public enum AggregationFunction {
    LAST(FunctionDescriptor.aggregation("last", SINGLE_SCALAR, TIMESTAMP_COLUMN, VALUE_COLUMN)) {
        @Override
        public Aggregator<?> bind(ParsedArgs args) {
            return new LastAggregator(args.getString(0), args.getString(1));
        }
    },
    FIRST(FunctionDescriptor.aggregation("first", SINGLE_SCALAR, TIMESTAMP_COLUMN, VALUE_COLUMN)) {
        @Override
        public Aggregator<?> bind(ParsedArgs args) {
            return new FirstAggregator(args.getString(0), args.getString(1));
        }
    },
    SUM(FunctionDescriptor.aggregation("sum", SINGLE_SCALAR, VALUE_COLUMN)) {
        @Override
        public Aggregator<?> bind(ParsedArgs args) {
            return new ScalarAggregator(ScalarAggregator.Op.SUM, args.getString(0));
        }
    },
    COUNT(FunctionDescriptor.aggregation("count", SINGLE_SCALAR, VALUE_COLUMN)) {
        @Override
        public Aggregator<?> bind(ParsedArgs args) {
            return new CountAggregator(args.getString(0));
        }
    },
    MIN(FunctionDescriptor.aggregation("min", SINGLE_SCALAR, VALUE_COLUMN)) {
        @Override
        public Aggregator<?> bind(ParsedArgs args) {
            return new ScalarAggregator(ScalarAggregator.Op.MIN, args.getString(0));
        }
    },
    MAX(FunctionDescriptor.aggregation("max", SINGLE_SCALAR, VALUE_COLUMN)) {
        @Override
        public Aggregator<?> bind(ParsedArgs args) {
            return new ScalarAggregator(ScalarAggregator.Op.MAX, args.getString(0));
        }
    },
    AVG(FunctionDescriptor.aggregation("avg", SINGLE_SCALAR, VALUE_COLUMN)) {
        @Override
        public Aggregator<?> bind(ParsedArgs args) {
            return new ScalarAggregator(ScalarAggregator.Op.AVG, args.getString(0));
        }
    },
    TIMEGROUP_MIN(timeGroup("timegroup_min")) {
        @Override
        public Aggregator<?> bind(ParsedArgs args) {
            return bindTimeGroup(TimeGroupAggregator.Op.MIN, args);
        }

        @Override
        public BadArgument check(ParsedArgs args) {
            return checkTimeGroup(descriptor, args);
        }
    },
    TIMEGROUP_MAX(timeGroup("timegroup_max")) {
        @Override
        public Aggregator<?> bind(ParsedArgs args) {
            return bindTimeGroup(TimeGroupAggregator.Op.MAX, args);
        }

        @Override
        public BadArgument check(ParsedArgs args) {
            return checkTimeGroup(descriptor, args);
        }
    },
    TIMEGROUP_AVG(timeGroup("timegroup_avg")) {
        @Override
        public Aggregator<?> bind(ParsedArgs args) {
            return bindTimeGroup(TimeGroupAggregator.Op.AVG, args);
        }

        @Override
        public BadArgument check(ParsedArgs args) {
            return checkTimeGroup(descriptor, args);
        }
    },
    //
    ;

    public final FunctionDescriptor descriptor;

    AggregationFunction(FunctionDescriptor descriptor) {
        this.descriptor = descriptor;
    }

    /**
     * Create the aggregator for arguments which passed {@link #check}.
     */
    public abstract Aggregator<?> bind(ParsedArgs args);

    /**
     * Check argument values beyond their types.
     *
     * @return null if all good.
     */
    public BadArgument check(ParsedArgs args) {
        return null;
    }

    private static FunctionDescriptor timeGroup(String name) {
        return FunctionDescriptor.aggregation(name, MULTI_POINT, TIMESTAMP_COLUMN, VALUE_COLUMN, LONG, LONG, INTEGER);
    }

    private static BadArgument checkTimeGroup(FunctionDescriptor descriptor, ParsedArgs args) {
        if (args.getLong(2) >= args.getLong(3)) {
            return new BadArgument(descriptor.name, 3, args.raw(3), "end must be greater than start " + args.raw(2));
        }
        if (args.getInt(4) <= 0) {
            return new BadArgument(descriptor.name, 4, args.raw(4), "window count must be positive");
        }
        return null;
    }

    private static Aggregator<?> bindTimeGroup(TimeGroupAggregator.Op op, ParsedArgs args) {
        return new TimeGroupAggregator(op,
                args.getString(0), args.getString(1),
                args.getLong(2), args.getLong(3), args.getInt(4));
    }
}
