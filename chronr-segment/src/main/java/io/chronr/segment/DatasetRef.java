package io.chronr.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;

import org.apache.commons.lang.StringUtils;

/**
 * The name of a dataset, i.e. a table of time series.
 */
public class DatasetRef {
    @JsonProperty("dataset")
    public final String dataset;

    @JsonCreator
    public DatasetRef(@JsonProperty("dataset") String dataset) {
        Preconditions.checkArgument(!StringUtils.isBlank(dataset), "dataset name is blank");
        this.dataset = dataset.trim();
    }

    public static DatasetRef of(String dataset) {
        return new DatasetRef(dataset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return dataset.equals(((DatasetRef) o).dataset);
    }

    @Override
    public int hashCode() {
        return dataset.hashCode();
    }

    @Override
    public String toString() {
        return dataset;
    }
}
