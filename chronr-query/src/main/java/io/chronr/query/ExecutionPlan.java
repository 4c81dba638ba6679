package io.chronr.query;

import com.google.common.collect.ImmutableList;

import java.util.List;

import io.chronr.query.func.AggregationFunction;
import io.chronr.query.func.Aggregator;
import io.chronr.query.func.Combiner;
import io.chronr.query.func.CombinerFunction;
import io.chronr.query.func.ParsedArgs;
import io.chronr.segment.DatasetSchema;

/**
 * A validated query, ready to run. Immutable and shared by all the tasks of the query.
 */
public class ExecutionPlan {
    public final DatasetSchema schema;
    public final QuerySpec spec;
    public final AggregationFunction aggregation;
    public final ParsedArgs aggregateArgs;
    public final CombinerFunction combination;
    public final ParsedArgs combinerArgs;
    public final Aggregator<?> aggregator;
    public final Combiner combiner;
    /** The columns the aggregation reads. */
    public final List<String> columns;

    ExecutionPlan(DatasetSchema schema,
                  QuerySpec spec,
                  AggregationFunction aggregation,
                  ParsedArgs aggregateArgs,
                  CombinerFunction combination,
                  ParsedArgs combinerArgs,
                  List<String> columns) {
        this.schema = schema;
        this.spec = spec;
        this.aggregation = aggregation;
        this.aggregateArgs = aggregateArgs;
        this.combination = combination;
        this.combinerArgs = combinerArgs;
        this.columns = ImmutableList.copyOf(columns);
        this.aggregator = aggregation.bind(aggregateArgs);
        this.combiner = combination.bind(combinerArgs);
    }

    @Override
    public String toString() {
        return "ExecutionPlan{" +
                "dataset=" + schema.ref +
                ", aggregation=" + aggregation.descriptor.name + aggregateArgs +
                ", combiner=" + combination.descriptor.name + combinerArgs +
                ", columns=" + columns +
                '}';
    }
}
