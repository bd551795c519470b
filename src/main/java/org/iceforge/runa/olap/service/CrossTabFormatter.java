package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.config.OlapProperties;
import org.iceforge.runa.olap.model.ClassifiedRow;
import org.iceforge.runa.olap.model.CrossTab;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.GroupingSet;
import org.iceforge.runa.olap.model.Measure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pivots grouping-sets output into a geography x product matrix.
 *
 * <p>Cells are summed from detail rows (time summed away here), never copied from the column subtotals, so time is
 * aggregated exactly once. Margins come from the subtotal rows and are then checked against the cells.
 */
@Service
public class CrossTabFormatter {

    private static final Logger log = LoggerFactory.getLogger(CrossTabFormatter.class);

    private final BigDecimal revenueTolerance;

    public CrossTabFormatter(OlapProperties props) {
        this.revenueTolerance = Objects.requireNonNull(props.getRevenueTolerance());
    }

    /**
     * @throws ReconciliationException if margins or the grand total disagree with the cells
     */
    public CrossTab format(List<ClassifiedRow> rows, Measure measure) {
        Objects.requireNonNull(measure);
        Map<GroupingSet, List<ClassifiedRow>> bySet = new LinkedHashMap<>();
        for (GroupingSet set : GroupingSet.values()) {
            bySet.put(set, new ArrayList<>());
        }
        for (ClassifiedRow r : rows) {
            if (!(r.level() instanceof GroupingSet set)) {
                throw new IllegalArgumentException("Cross-tabs are built from grouping-sets rows, got level " + r.level().label());
            }
            bySet.get(set).add(r);
        }

        List<ClassifiedRow> detail = bySet.get(GroupingSet.DETAIL);
        Map<Object, Integer> rowIndex = index(detail, Dimension.GEOGRAPHY);
        Map<Object, Integer> colIndex = index(detail, Dimension.PRODUCT);

        BigDecimal[][] cells = zeros(rowIndex.size(), colIndex.size());
        Map<List<Object>, BigDecimal[]> layers = new LinkedHashMap<>();
        for (ClassifiedRow r : detail) {
            int ri = rowIndex.get(r.value(Dimension.GEOGRAPHY));
            int ci = colIndex.get(r.value(Dimension.PRODUCT));
            BigDecimal v = r.measures().value(measure);
            cells[ri][ci] = cells[ri][ci].add(v);

            List<Object> layerKey = Arrays.asList(r.value(Dimension.GEOGRAPHY), r.value(Dimension.TIME));
            BigDecimal[] layer = layers.computeIfAbsent(layerKey, k -> zeros(1, colIndex.size())[0]);
            layer[ci] = layer[ci].add(v);
        }

        BigDecimal[] rowMargins = zeros(1, rowIndex.size())[0];
        for (ClassifiedRow r : bySet.get(GroupingSet.ROW_SUBTOTAL)) {
            int ri = lookup(rowIndex, r.value(Dimension.GEOGRAPHY), "row subtotal", "geography");
            rowMargins[ri] = rowMargins[ri].add(r.measures().value(measure));
        }

        BigDecimal[] colMargins = zeros(1, colIndex.size())[0];
        for (ClassifiedRow r : bySet.get(GroupingSet.COLUMN_SUBTOTAL)) {
            int ci = lookup(colIndex, r.value(Dimension.PRODUCT), "column subtotal", "product");
            colMargins[ci] = colMargins[ci].add(r.measures().value(measure));
        }

        List<ClassifiedRow> grand = bySet.get(GroupingSet.GRAND_TOTAL);
        if (grand.size() != 1) {
            throw fail("Expected exactly one grand-total row, got " + grand.size());
        }
        BigDecimal grandTotal = grand.get(0).measures().value(measure);

        reconcile(measure, cells, rowIndex, colIndex, rowMargins, colMargins, grandTotal);
        reconcileGeoTotals(measure, bySet.get(GroupingSet.GEO_TOTAL), rowIndex, rowMargins);

        List<List<BigDecimal>> cellList = new ArrayList<>(cells.length);
        for (BigDecimal[] row : cells) {
            cellList.add(List.of(row));
        }
        List<CrossTab.TimeLayer> timeLayers = new ArrayList<>(layers.size());
        layers.forEach((k, v) -> timeLayers.add(new CrossTab.TimeLayer(k.get(0), k.get(1), List.of(v))));

        return new CrossTab(measure,
                Collections.unmodifiableList(new ArrayList<>(rowIndex.keySet())),
                Collections.unmodifiableList(new ArrayList<>(colIndex.keySet())),
                List.copyOf(cellList),
                List.of(rowMargins),
                List.of(colMargins),
                grandTotal,
                List.copyOf(timeLayers));
    }

    private void reconcile(Measure measure, BigDecimal[][] cells, Map<Object, Integer> rowIndex, Map<Object, Integer> colIndex,
                           BigDecimal[] rowMargins, BigDecimal[] colMargins, BigDecimal grandTotal) {
        BigDecimal all = BigDecimal.ZERO;
        BigDecimal[] colSums = zeros(1, colMargins.length)[0];
        for (Map.Entry<Object, Integer> row : rowIndex.entrySet()) {
            BigDecimal rowSum = BigDecimal.ZERO;
            for (int c = 0; c < colSums.length; c++) {
                BigDecimal v = cells[row.getValue()][c];
                rowSum = rowSum.add(v);
                colSums[c] = colSums[c].add(v);
            }
            if (!agrees(measure, rowSum, rowMargins[row.getValue()])) {
                throw fail(measure + " row margin for " + row.getKey() + " is " + rowMargins[row.getValue()]
                        + " but its cells sum to " + rowSum);
            }
            all = all.add(rowSum);
        }
        for (Map.Entry<Object, Integer> col : colIndex.entrySet()) {
            if (!agrees(measure, colSums[col.getValue()], colMargins[col.getValue()])) {
                throw fail(measure + " column margin for " + col.getKey() + " is " + colMargins[col.getValue()]
                        + " but its cells sum to " + colSums[col.getValue()]);
            }
        }
        if (!agrees(measure, all, grandTotal)) {
            throw fail(measure + " grand total is " + grandTotal + " but the cells sum to " + all);
        }
    }

    private void reconcileGeoTotals(Measure measure, List<ClassifiedRow> geoTotals, Map<Object, Integer> rowIndex, BigDecimal[] rowMargins) {
        for (ClassifiedRow r : geoTotals) {
            int ri = lookup(rowIndex, r.value(Dimension.GEOGRAPHY), "geographic total", "geography");
            BigDecimal v = r.measures().value(measure);
            if (!agrees(measure, v, rowMargins[ri])) {
                throw fail(measure + " geographic total for " + r.value(Dimension.GEOGRAPHY) + " is " + v
                        + " but its row margin is " + rowMargins[ri]);
            }
        }
    }

    boolean agrees(Measure measure, BigDecimal a, BigDecimal b) {
        BigDecimal diff = a.subtract(b).abs();
        return measure.isIntegral() ? diff.signum() == 0 : diff.compareTo(revenueTolerance) <= 0;
    }

    private static Map<Object, Integer> index(List<ClassifiedRow> rows, Dimension dimension) {
        Map<Object, Integer> index = new LinkedHashMap<>();
        for (ClassifiedRow r : rows) {
            index.putIfAbsent(r.value(dimension), index.size());
        }
        return index;
    }

    private int lookup(Map<Object, Integer> index, Object key, String what, String dimension) {
        Integer i = index.get(key);
        if (i == null) {
            throw fail("A " + what + " row has " + dimension + " value " + key + " that no detail row has");
        }
        return i;
    }

    private static BigDecimal[][] zeros(int rows, int cols) {
        BigDecimal[][] m = new BigDecimal[rows][cols];
        for (BigDecimal[] row : m) {
            Arrays.fill(row, BigDecimal.ZERO);
        }
        return m;
    }

    private static ReconciliationException fail(String message) {
        log.warn("Cross-tab does not reconcile: {}", message);
        return new ReconciliationException(message);
    }
}
