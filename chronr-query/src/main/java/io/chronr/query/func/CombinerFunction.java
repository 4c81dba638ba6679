package io.chronr.query.func;

import io.chronr.query.BadArgument;

import static io.chronr.query.func.ArgType.DOUBLE;
import static io.chronr.query.func.ArgType.INTEGER;
import static io.chronr.query.func.OutputShape.SINGLE_SCALAR;

/**
 * The ways per partition results can be folded into the final answer.
 */
public enum CombinerFunction {
    /** Every series' result as is. */
    SIMPLE(FunctionDescriptor.combiner("simple", null, 0), "list") {
        @Override
        public Combiner bind(ParsedArgs args) {
            return new ListCombiner();
        }
    },
    /** Args: upper bound, [bucket count]. */
    HISTOGRAM(FunctionDescriptor.combiner("histogram", SINGLE_SCALAR, 1, DOUBLE, INTEGER)) {
        @Override
        public Combiner bind(ParsedArgs args) {
            return new HistogramCombiner(args.getDouble(0), args.getInt(1, HistogramCombiner.DEFAULT_BUCKETS));
        }

        @Override
        public BadArgument check(ParsedArgs args) {
            if (args.getDouble(0) <= 1) {
                return new BadArgument(descriptor.name, 0, args.raw(0), "histogram max must be greater than 1");
            }
            if (args.has(1) && args.getInt(1) <= 0) {
                return new BadArgument(descriptor.name, 1, args.raw(1), "bucket count must be positive");
            }
            return null;
        }
    },
    //
    ;

    public final FunctionDescriptor descriptor;
    public final String[] aliases;

    CombinerFunction(FunctionDescriptor descriptor, String... aliases) {
        this.descriptor = descriptor;
        this.aliases = aliases;
    }

    /**
     * Create the combiner for arguments which passed {@link #check}.
     */
    public abstract Combiner bind(ParsedArgs args);

    /**
     * @return null if all good.
     */
    public BadArgument check(ParsedArgs args) {
        return null;
    }
}
