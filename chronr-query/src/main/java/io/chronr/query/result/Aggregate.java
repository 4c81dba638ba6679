package io.chronr.query.result;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.chronr.util.JsonUtil;

/**
 * The final result of a query. One of the {@link Kind}s.
 */
public abstract class Aggregate {

    public enum Kind {
        LIST,
        HISTOGRAM,
    }

    Aggregate() {}

    @JsonProperty("kind")
    public abstract Kind kind();

    @Override
    public String toString() {
        return JsonUtil.toJson(this);
    }
}
