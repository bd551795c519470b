package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.model.AggregateRow;
import org.iceforge.runa.olap.model.AggregationRequest;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.GroupingFlags;
import org.iceforge.runa.olap.model.Measures;

import java.util.List;
import java.util.function.Function;

/**
 * Runs one aggregation request against the warehouse and blocks until its rows are available.
 * Implementations neither retry nor cancel.
 */
public interface AggregationExecutor {

    /**
     * @throws AggregationExecutionException if the engine fails or answers with something unreadable
     */
    List<AggregateRow> execute(AggregationRequest request);

    /**
     * Maps one result row, given access to its columns by the aliases of {@link AggregationSqlCompiler}.
     */
    static AggregateRow toRow(Function<String, Object> column) {
        GroupingFlags flags = new GroupingFlags(
                isSet(column.apply(AggregationSqlCompiler.groupingColumn(Dimension.GEOGRAPHY))),
                isSet(column.apply(AggregationSqlCompiler.groupingColumn(Dimension.TIME))),
                isSet(column.apply(AggregationSqlCompiler.groupingColumn(Dimension.PRODUCT))));
        Object quantity = column.apply(AggregationSqlCompiler.TOTAL_QUANTITY);
        Object revenue = column.apply(AggregationSqlCompiler.TOTAL_REVENUE);
        Object count = column.apply(AggregationSqlCompiler.TRANSACTION_COUNT);
        Object avgUnitPrice = column.apply(AggregationSqlCompiler.AVG_UNIT_PRICE);
        Measures measures;
        try {
            measures = Measures.fromNumbers(quantity, revenue, count, avgUnitPrice);
        } catch (NumberFormatException | ArithmeticException e) {
            throw new AggregationExecutionException("Unreadable measure in result row: quantity=" + quantity
                    + ", revenue=" + revenue + ", count=" + count + ", avgUnitPrice=" + avgUnitPrice, e);
        }
        return AggregateRow.of(
                column.apply(AggregationSqlCompiler.valueColumn(Dimension.GEOGRAPHY)),
                column.apply(AggregationSqlCompiler.valueColumn(Dimension.TIME)),
                column.apply(AggregationSqlCompiler.valueColumn(Dimension.PRODUCT)),
                flags, measures);
    }

    private static boolean isSet(Object grouping) {
        if (grouping == null) {
            throw new AggregationExecutionException("Result row has no grouping marker");
        }
        if (grouping instanceof Boolean b) {
            return b;
        }
        if (grouping instanceof Number n) {
            return n.intValue() != 0;
        }
        try {
            return Integer.parseInt(grouping.toString().trim()) != 0;
        } catch (NumberFormatException e) {
            throw new AggregationExecutionException("Unreadable grouping marker '" + grouping + "'", e);
        }
    }
}
