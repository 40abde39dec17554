package com.logchef.logchefql;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered column list of the queried table. Only used to pick the access strategy
 * for nested fields and projected columns.
 */
public final class Schema {

    @JsonProperty("columns")
    private final List<ColumnInfo> columns;

    @JsonCreator
    public Schema(@JsonProperty("columns") List<ColumnInfo> columns) {
        this.columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ColumnInfo> getColumns() {
        return columns;
    }

    public Optional<ColumnInfo> findColumn(String name) {
        for (ColumnInfo column : columns) {
            if (column.getName().equals(name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    public boolean hasColumn(String name) {
        return findColumn(name).isPresent();
    }

    /**
     * First Map-typed column in declaration order, used as the home of unknown fields
     */
    public Optional<ColumnInfo> firstMapColumn() {
        for (ColumnInfo column : columns) {
            if (column.isMapType()) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    public static final class Builder {
        private final List<ColumnInfo> columns = new ArrayList<>();

        private Builder() {
        }

        public Builder column(String name, String type) {
            columns.add(new ColumnInfo(name, type));
            return this;
        }

        public Schema build() {
            return new Schema(columns);
        }
    }
}
