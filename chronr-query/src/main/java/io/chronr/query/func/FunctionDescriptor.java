package io.chronr.query.func;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.apache.commons.lang.StringUtils;

import java.util.ArrayList;
import java.util.List;

import io.chronr.query.BadArgument;
import io.chronr.query.Result;
import io.chronr.query.WrongNumberArguments;
import io.chronr.segment.DatasetSchema;

/**
 * The argument schema of an aggregation or combiner function.
 * 
 * Arguments at positions <code>[minArgs, maxArgs)</code> are optional. An aggregation function
 * declares the shape of what it outputs, a combiner the shape it requires as input, or null for any.
 */
public class FunctionDescriptor {
    public final String name;
    public final List<ArgType> argTypes;
    public final int minArgs;
    public final int maxArgs;
    public final OutputShape output;
    public final OutputShape requiredInput;

    private FunctionDescriptor(String name,
                               int minArgs,
                               List<ArgType> argTypes,
                               OutputShape output,
                               OutputShape requiredInput) {
        Preconditions.checkArgument(minArgs >= 0 && minArgs <= argTypes.size());
        this.name = name;
        this.argTypes = ImmutableList.copyOf(argTypes);
        this.minArgs = minArgs;
        this.maxArgs = argTypes.size();
        this.output = output;
        this.requiredInput = requiredInput;
    }

    public static FunctionDescriptor aggregation(String name, OutputShape output, ArgType... argTypes) {
        return new FunctionDescriptor(name, argTypes.length, ImmutableList.copyOf(argTypes), output, null);
    }

    public static FunctionDescriptor combiner(String name, OutputShape requiredInput, int minArgs, ArgType... argTypes) {
        return new FunctionDescriptor(name, minArgs, ImmutableList.copyOf(argTypes), null, requiredInput);
    }

    /**
     * Whether a combiner described by this accepts what <code>aggregation</code> outputs.
     */
    public boolean accepts(FunctionDescriptor aggregation) {
        return requiredInput == null || requiredInput == aggregation.output;
    }

    /**
     * Check the argument count, then parse each argument by its position. A parse error is only
     * reported once the count is right.
     */
    public Result<ParsedArgs> parseArgs(List<String> raw, DatasetSchema schema) {
        if (raw.size() < minArgs || raw.size() > maxArgs) {
            return Result.bad(new WrongNumberArguments(raw.size(), minArgs));
        }
        List<Object> values = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String r = raw.get(i);
            if (StringUtils.isBlank(r)) {
                return Result.bad(new BadArgument(name, i, r, "missing " + argTypes.get(i).label));
            }
            try {
                values.add(argTypes.get(i).parse(r, schema));
            } catch (IllegalArgumentException e) {
                return Result.bad(new BadArgument(name, i, r, e.getMessage()));
            }
        }
        return Result.good(new ParsedArgs(raw, values));
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(name).append('(');
        for (int i = 0; i < argTypes.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(i >= minArgs ? "[" + argTypes.get(i).label + "]" : argTypes.get(i).label);
        }
        return sb.append(')').toString();
    }
}
