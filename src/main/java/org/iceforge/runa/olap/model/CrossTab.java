package org.iceforge.runa.olap.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Geography x product pivot of one measure, aggregated over time, with margins.
 *
 * @param rowKeys       geography values, one per matrix row
 * @param columnKeys    product values, one per matrix column
 * @param cells         {@code cells.get(r).get(c)}; absent combinations are zero
 * @param rowMargins    per geography, from the row-subtotal rows
 * @param columnMargins per product, from the column-subtotal rows
 * @param grandTotal    from the grand-total row
 * @param timeLayers    per geography and time value, the detail cells before time was summed away
 */
public record CrossTab(Measure measure,
                       List<Object> rowKeys,
                       List<Object> columnKeys,
                       List<List<BigDecimal>> cells,
                       List<BigDecimal> rowMargins,
                       List<BigDecimal> columnMargins,
                       BigDecimal grandTotal,
                       List<TimeLayer> timeLayers) {

    public BigDecimal cell(int row, int column) {
        return cells.get(row).get(column);
    }

    public record TimeLayer(Object geo, Object time, List<BigDecimal> cells) {
    }
}
