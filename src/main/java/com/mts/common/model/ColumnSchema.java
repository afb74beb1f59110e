package com.mts.common.model;

import java.util.Objects;

public class ColumnSchema {
    private String name;
    private DataType type;
    private boolean nullable;

    public ColumnSchema() {
    }

    public ColumnSchema(String name, DataType type, boolean nullable) {
        this.name = name;
        this.type = type;
        this.nullable = nullable;
    }

    public ColumnSchema(ColumnSchema other) {
        this(other.name, other.type, other.nullable);
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public DataType getType() {
        return type;
    }

    public void setType(DataType type) {
        this.type = type;
    }

    public boolean isNullable() {
        return nullable;
    }

    public void setNullable(boolean nullable) {
        this.nullable = nullable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnSchema)) return false;
        ColumnSchema that = (ColumnSchema) o;
        return nullable == that.nullable && Objects.equals(name, that.name) && type == that.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, nullable);
    }

    @Override
    public String toString() {
        return name + " " + type + (nullable ? " NULL" : " NOT NULL");
    }
}
