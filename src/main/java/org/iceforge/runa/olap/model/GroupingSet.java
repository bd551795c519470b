package org.iceforge.runa.olap.model;

import java.util.List;

import static org.iceforge.runa.olap.model.Dimension.GEOGRAPHY;
import static org.iceforge.runa.olap.model.Dimension.PRODUCT;
import static org.iceforge.runa.olap.model.Dimension.TIME;

/**
 * The grouping sets issued for a cross-tab: geography rows, product columns, time as the row layer.
 *
 * <p>This is a curated list, not a subset of the cube picked by rule. {@code {time}}, {@code {product}} and
 * {@code {time, product}} are never issued.
 */
public enum GroupingSet implements AggregationLevel {
    DETAIL("Detail", List.of(GEOGRAPHY, TIME, PRODUCT)),
    ROW_SUBTOTAL("Row Subtotal", List.of(GEOGRAPHY, TIME)),
    COLUMN_SUBTOTAL("Column Subtotal", List.of(GEOGRAPHY, PRODUCT)),
    GEO_TOTAL("Geographic Total", List.of(GEOGRAPHY)),
    GRAND_TOTAL("Grand Total", List.of());

    private final String label;
    private final List<Dimension> dimensions;

    GroupingSet(String label, List<Dimension> dimensions) {
        this.label = label;
        this.dimensions = dimensions;
    }

    @Override
    public String label() {
        return label;
    }

    /**
     * Dimensions grouped by in this set, in declaration order.
     */
    public List<Dimension> dimensions() {
        return dimensions;
    }

    @Override
    public GroupingFlags flags() {
        return new GroupingFlags(!dimensions.contains(GEOGRAPHY), !dimensions.contains(TIME), !dimensions.contains(PRODUCT));
    }

    @Override
    public boolean isDetail() {
        return this == DETAIL;
    }
}
