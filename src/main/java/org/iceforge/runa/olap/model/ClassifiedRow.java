package org.iceforge.runa.olap.model;

import java.util.Objects;

public record ClassifiedRow(AggregateRow row, AggregationLevel level) {

    public ClassifiedRow {
        Objects.requireNonNull(row, "row");
        Objects.requireNonNull(level, "level");
    }

    public Object value(Dimension dimension) {
        return row.value(dimension);
    }

    public Measures measures() {
        return row.measures();
    }
}
