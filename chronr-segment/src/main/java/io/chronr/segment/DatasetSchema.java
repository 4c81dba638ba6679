package io.chronr.segment;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;

import io.chronr.util.JsonUtil;
import io.chronr.util.Trick;

/**
 * Schema of a time-series dataset.
 * 
 * Every record carries a partition column, whose value is the series key, and a timestamp column.
 * All the other columns are data columns.
 */
public class DatasetSchema {
    @JsonIgnore
    public final DatasetRef ref;
    @JsonIgnore
    public final List<ColumnSchema> columns;
    @JsonIgnore
    public final String partitionColumn;
    @JsonIgnore
    public final String timestampColumn;

    @JsonCreator
    public DatasetSchema(@JsonProperty("dataset") String dataset,
                         @JsonProperty("columns") List<ColumnSchema> columns,
                         @JsonProperty("partitionColumn") String partitionColumn,
                         @JsonProperty("timestampColumn") String timestampColumn) {
        this(DatasetRef.of(dataset), columns, partitionColumn, timestampColumn);
    }

    public DatasetSchema(DatasetRef ref,
                         List<ColumnSchema> columns,
                         String partitionColumn,
                         String timestampColumn) {
        Preconditions.checkNotNull(ref);
        Preconditions.checkArgument(columns != null && !columns.isEmpty(), "no columns");
        Trick.notRepeated(columns, ColumnSchema::getName);

        this.ref = ref;
        this.columns = ImmutableList.copyOf(columns);
        this.partitionColumn = partitionColumn.toLowerCase().trim();
        this.timestampColumn = timestampColumn.toLowerCase().trim();

        ColumnSchema pc = column(this.partitionColumn);
        ColumnSchema tc = column(this.timestampColumn);
        if (pc == null || pc.type != ColumnType.STRING) {
            throw new IllegalStateException("Partition column must be a STRING column: " + partitionColumn);
        }
        if (tc == null || !tc.type.isIntegral()) {
            throw new IllegalStateException("Timestamp column must be a TIMESTAMP or LONG column: " + timestampColumn);
        }
    }

    @JsonProperty("dataset")
    public String getDataset() {
        return ref.dataset;
    }

    @JsonProperty("columns")
    public List<ColumnSchema> getColumns() {
        return columns;
    }

    @JsonProperty("partitionColumn")
    public String getPartitionColumn() {
        return partitionColumn;
    }

    @JsonProperty("timestampColumn")
    public String getTimestampColumn() {
        return timestampColumn;
    }

    /**
     * @return the column ordinal, or -1 if not found.
     */
    public int columnIndex(String name) {
        if (name == null) {
            return -1;
        }
        String lower = name.toLowerCase().trim();
        return Trick.indexFirst(columns, c -> c.name.equals(lower));
    }

    /**
     * @return the column, or null if not found.
     */
    public ColumnSchema column(String name) {
        int index = columnIndex(name);
        return index < 0 ? null : columns.get(index);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        DatasetSchema schema = (DatasetSchema) o;
        return ref.equals(schema.ref)
                && columns.equals(schema.columns)
                && partitionColumn.equals(schema.partitionColumn)
                && timestampColumn.equals(schema.timestampColumn);
    }

    @Override
    public int hashCode() {
        return ref.hashCode() * 31 + columns.hashCode();
    }

    @Override
    public String toString() {
        return JsonUtil.toJson(this);
    }
}
