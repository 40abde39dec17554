package com.logchef.logchefql;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Objects;

/**
 * Column name and ClickHouse type as reported by the source table
 */
public final class ColumnInfo {

    @JsonProperty("name")
    private final String name;

    @JsonProperty("type")
    private final String type;

    @JsonCreator
    public ColumnInfo(@JsonProperty("name") String name, @JsonProperty("type") String type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = type == null ? "" : type;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    @JsonIgnore
    public boolean isMapType() {
        return normalizedType().startsWith("map(");
    }

    @JsonIgnore
    public boolean isJsonType() {
        String lower = normalizedType();
        return lower.equals("json") || lower.startsWith("json(") || lower.equals("newjson");
    }

    @JsonIgnore
    public boolean isStringType() {
        String lower = normalizedType();
        return lower.equals("string")
                || lower.startsWith("string(")
                || lower.startsWith("fixedstring(")
                || lower.startsWith("lowcardinality(string)")
                || lower.startsWith("nullable(string)");
    }

    private String normalizedType() {
        return type.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnInfo)) return false;
        ColumnInfo that = (ColumnInfo) o;
        return name.equals(that.name) && type.equals(that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type);
    }

    @Override
    public String toString() {
        return name + " " + type;
    }
}
