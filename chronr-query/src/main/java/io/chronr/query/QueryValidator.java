package io.chronr.query;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import io.chronr.query.func.AggregationFunction;
import io.chronr.query.func.ArgType;
import io.chronr.query.func.CombinerFunction;
import io.chronr.query.func.FunctionDescriptor;
import io.chronr.query.func.FunctionRegistry;
import io.chronr.query.func.ParsedArgs;
import io.chronr.segment.DatasetSchema;

/**
 * Turns a {@link QuerySpec} into an {@link ExecutionPlan}, or the first error found.
 * 
 * Checks run in this order: function names, shape compatibility of the pair, then the aggregation
 * arguments and the combiner arguments, each by count, then by type, then by value.
 */
public class QueryValidator {
    private static final Logger logger = LoggerFactory.getLogger(QueryValidator.class);

    private QueryValidator() {}

    public static Result<ExecutionPlan> validate(DatasetSchema schema, QuerySpec spec) {
        Result<ExecutionPlan> res = doValidate(schema, spec);
        if (res.isBad()) {
            logger.debug("Query rejected. [dataset: {}, query: {}, error: {}]", schema.ref, spec, res.error());
        }
        return res;
    }

    private static Result<ExecutionPlan> doValidate(DatasetSchema schema, QuerySpec spec) {
        AggregationFunction aggregation = FunctionRegistry.aggregation(spec.aggregateFunc);
        if (aggregation == null) {
            return Result.bad(new InvalidAggregator(String.format(
                    "Unknown aggregation function [%s], available: %s", spec.aggregateFunc, FunctionRegistry.aggregationNames())));
        }
        CombinerFunction combination = FunctionRegistry.combiner(spec.combinerFunc);
        if (combination == null) {
            return Result.bad(new InvalidAggregator(String.format(
                    "Unknown combiner function [%s], available: %s", spec.combinerFunc, FunctionRegistry.combinerNames())));
        }
        if (!combination.descriptor.accepts(aggregation.descriptor)) {
            return Result.bad(new InvalidAggregator(String.format(
                    "Combiner %s requires %s input, but %s outputs %s",
                    combination.descriptor.name, combination.descriptor.requiredInput,
                    aggregation.descriptor.name, aggregation.descriptor.output)));
        }

        Result<ParsedArgs> aggArgs = aggregation.descriptor.parseArgs(spec.aggregateArgs, schema);
        if (aggArgs.isBad()) {
            return Result.bad(aggArgs.error());
        }
        BadArgument aggBad = aggregation.check(aggArgs.get());
        if (aggBad != null) {
            return Result.bad(aggBad);
        }

        Result<ParsedArgs> combArgs = combination.descriptor.parseArgs(spec.combinerArgs, schema);
        if (combArgs.isBad()) {
            return Result.bad(combArgs.error());
        }
        BadArgument combBad = combination.check(combArgs.get());
        if (combBad != null) {
            return Result.bad(combBad);
        }

        return Result.good(new ExecutionPlan(
                schema, spec,
                aggregation, aggArgs.get(),
                combination, combArgs.get(),
                requestedColumns(schema, aggregation.descriptor, aggArgs.get())));
    }

    private static List<String> requestedColumns(DatasetSchema schema, FunctionDescriptor descriptor, ParsedArgs args) {
        List<String> columns = new ArrayList<>();
        if (!descriptor.argTypes.contains(ArgType.TIMESTAMP_COLUMN)) {
            // Read along with the value column.
            columns.add(schema.timestampColumn);
        }
        for (int i = 0; i < args.size(); i++) {
            ArgType type = descriptor.argTypes.get(i);
            if ((type == ArgType.TIMESTAMP_COLUMN || type == ArgType.VALUE_COLUMN) && !columns.contains(args.getString(i))) {
                columns.add(args.getString(i));
            }
        }
        return columns;
    }
}
