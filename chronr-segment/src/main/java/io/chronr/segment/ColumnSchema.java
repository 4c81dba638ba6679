package io.chronr.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;

import io.chronr.util.JsonUtil;

public class ColumnSchema {
    @JsonIgnore
    public final String name;
    @JsonIgnore
    public final ColumnType type;

    @JsonCreator
    public ColumnSchema(@JsonProperty("name") String name,
                        @JsonProperty("dataType") String typeName) {
        this(name, ColumnType.fromName(typeName));
    }

    public ColumnSchema(String name, ColumnType type) {
        Preconditions.checkArgument(!StringUtils.isBlank(name), "column name is blank");
        Preconditions.checkNotNull(type);
        this.name = name.toLowerCase().trim().intern();
        this.type = type;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("dataType")
    public String getTypeName() {
        return type.name();
    }

    @Override
    public String toString() {
        return JsonUtil.toJson(this);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ColumnSchema)) {
            return false;
        }
        ColumnSchema otherCS = (ColumnSchema) other;
        return StringUtils.equals(name, otherCS.name)
                && type == otherCS.type;
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + type.hashCode();
    }
}
