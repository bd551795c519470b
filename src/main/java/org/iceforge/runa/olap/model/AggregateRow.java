package org.iceforge.runa.olap.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One row returned by the engine.
 *
 * <p>A collapsed dimension never carries a value. A present dimension may still hold {@code null}: that is real
 * data, not a total, and only {@link #flags()} tells the two apart.
 *
 * @param dimensionValues one value per dimension in {@link Dimension} order, elements may be {@code null}
 */
public record AggregateRow(List<Object> dimensionValues, GroupingFlags flags, Measures measures) {

    public AggregateRow {
        Objects.requireNonNull(dimensionValues, "dimensionValues");
        Objects.requireNonNull(flags, "flags");
        Objects.requireNonNull(measures, "measures");
        if (dimensionValues.size() != Dimension.values().length) {
            throw new IllegalArgumentException("Expected " + Dimension.values().length + " dimension values, got " + dimensionValues.size());
        }
        List<Object> copy = new ArrayList<>(dimensionValues);
        for (Dimension d : Dimension.values()) {
            if (flags.isCollapsed(d)) {
                // engines put NULL in collapsed columns; never trust it as a value
                copy.set(d.ordinal(), null);
            }
        }
        dimensionValues = Collections.unmodifiableList(copy);
    }

    public static AggregateRow of(Object geo, Object time, Object product, GroupingFlags flags, Measures measures) {
        List<Object> values = new ArrayList<>(3);
        values.add(geo);
        values.add(time);
        values.add(product);
        return new AggregateRow(values, flags, measures);
    }

    public Object value(Dimension dimension) {
        return dimensionValues.get(dimension.ordinal());
    }

    public boolean isCollapsed(Dimension dimension) {
        return flags.isCollapsed(dimension);
    }
}
