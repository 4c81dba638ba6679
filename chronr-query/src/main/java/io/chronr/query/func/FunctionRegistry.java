package io.chronr.query.func;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Set;

/**
 * Name lookup of the aggregation and combiner functions. Names are case insensitive.
 * Built once at class loading, read only afterwards.
 */
public class FunctionRegistry {
    private static final ImmutableMap<String, AggregationFunction> aggregations;
    private static final ImmutableMap<String, CombinerFunction> combiners;

    static {
        ImmutableMap.Builder<String, AggregationFunction> aggBuilder = ImmutableMap.builder();
        for (AggregationFunction f : AggregationFunction.values()) {
            aggBuilder.put(f.descriptor.name, f);
        }
        aggregations = aggBuilder.build();

        ImmutableMap.Builder<String, CombinerFunction> combBuilder = ImmutableMap.builder();
        for (CombinerFunction f : CombinerFunction.values()) {
            combBuilder.put(f.descriptor.name, f);
            for (String alias : f.aliases) {
                combBuilder.put(alias, f);
            }
        }
        combiners = combBuilder.build();
    }

    private FunctionRegistry() {}

    /**
     * @return null if no such function.
     */
    public static AggregationFunction aggregation(String name) {
        return name == null ? null : aggregations.get(name.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * @return null if no such function.
     */
    public static CombinerFunction combiner(String name) {
        return name == null ? null : combiners.get(name.trim().toLowerCase(Locale.ROOT));
    }

    public static Set<String> aggregationNames() {
        return aggregations.keySet();
    }

    public static Set<String> combinerNames() {
        return combiners.keySet();
    }
}
