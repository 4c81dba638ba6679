package io.chronr.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

import io.chronr.util.JsonUtil;

/**
 * What a query asks for: an aggregation function applied to every partition, and a combiner
 * folding the per partition results together. Arguments are raw strings, parsed by validation.
 */
public class QuerySpec {
    @JsonIgnore
    public final String aggregateFunc;
    @JsonIgnore
    public final List<String> aggregateArgs;
    @JsonIgnore
    public final String combinerFunc;
    @JsonIgnore
    public final List<String> combinerArgs;

    @JsonCreator
    public QuerySpec(@JsonProperty("aggregateFunc") String aggregateFunc,
                     @JsonProperty("aggregateArgs") List<String> aggregateArgs,
                     @JsonProperty("combinerFunc") String combinerFunc,
                     @JsonProperty("combinerArgs") List<String> combinerArgs) {
        this.aggregateFunc = Preconditions.checkNotNull(aggregateFunc, "aggregateFunc");
        this.aggregateArgs = aggregateArgs == null ? ImmutableList.of() : ImmutableList.copyOf(aggregateArgs);
        this.combinerFunc = Preconditions.checkNotNull(combinerFunc, "combinerFunc");
        this.combinerArgs = combinerArgs == null ? ImmutableList.of() : ImmutableList.copyOf(combinerArgs);
    }

    @JsonProperty("aggregateFunc")
    public String getAggregateFunc() {
        return aggregateFunc;
    }

    @JsonProperty("aggregateArgs")
    public List<String> getAggregateArgs() {
        return aggregateArgs;
    }

    @JsonProperty("combinerFunc")
    public String getCombinerFunc() {
        return combinerFunc;
    }

    @JsonProperty("combinerArgs")
    public List<String> getCombinerArgs() {
        return combinerArgs;
    }

    public QuerySpec withAggregate(String func, List<String> args) {
        return new QuerySpec(func, args, combinerFunc, combinerArgs);
    }

    public QuerySpec withCombiner(String func, List<String> args) {
        return new QuerySpec(aggregateFunc, aggregateArgs, func, args);
    }

    public QuerySpec withCombinerArgs(List<String> args) {
        return new QuerySpec(aggregateFunc, aggregateArgs, combinerFunc, args);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        QuerySpec that = (QuerySpec) o;
        return aggregateFunc.equals(that.aggregateFunc)
                && aggregateArgs.equals(that.aggregateArgs)
                && combinerFunc.equals(that.combinerFunc)
                && combinerArgs.equals(that.combinerArgs);
    }

    @Override
    public int hashCode() {
        int h = aggregateFunc.hashCode();
        h = h * 31 + aggregateArgs.hashCode();
        h = h * 31 + combinerFunc.hashCode();
        return h * 31 + combinerArgs.hashCode();
    }

    @Override
    public String toString() {
        return JsonUtil.toJson(this);
    }
}
