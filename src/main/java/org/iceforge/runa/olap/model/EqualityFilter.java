package org.iceforge.runa.olap.model;

import java.util.Objects;

/**
 * {@code column = value}, applied to fact rows before aggregation. The value is always bound as a parameter.
 */
public record EqualityFilter(Dimension dimension, HierarchyLevel level, Object value) {

    public EqualityFilter {
        Objects.requireNonNull(dimension, "dimension");
        Objects.requireNonNull(level, "level");
        Objects.requireNonNull(value, "value");
    }

    public String columnRef() {
        return level.columnRef();
    }

    @Override
    public String toString() {
        return level.name() + "=" + value;
    }
}
