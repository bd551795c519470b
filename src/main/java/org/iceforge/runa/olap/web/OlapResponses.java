package org.iceforge.runa.olap.web;

import org.iceforge.runa.olap.model.AggregationResult;
import org.iceforge.runa.olap.model.ClassifiedRow;
import org.iceforge.runa.olap.model.CrossTab;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.HierarchyLevel;
import org.iceforge.runa.olap.model.Measures;
import org.iceforge.runa.olap.model.NavigationResult;
import org.iceforge.runa.olap.model.Position;
import org.iceforge.runa.olap.service.NavigationController;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON shapes returned by {@link OlapController}. Grouping flags are internal and not exposed; each row carries its
 * level label instead.
 */
public final class OlapResponses {

    private OlapResponses() {
    }

    public record DimensionView(String dimension, String level, int rank, int maxRank,
                                boolean canDrillDown, boolean canRollUp) {}

    public record SessionView(String sessionId, List<DimensionView> position, String filter) {

        static SessionView of(String sessionId, NavigationController session) {
            return new SessionView(sessionId, positionOf(session.position()),
                    session.sessionFilter() == null ? null : session.sessionFilter().toString());
        }
    }

    public record RowView(String level, Object geo, Object time, Object product,
                          long quantity, BigDecimal revenue, long count, BigDecimal avgUnitPrice) {

        static RowView of(ClassifiedRow r) {
            Measures m = r.measures();
            return new RowView(r.level().label(),
                    r.value(Dimension.GEOGRAPHY), r.value(Dimension.TIME), r.value(Dimension.PRODUCT),
                    m.quantity(), m.revenue(), m.count(), m.avgUnitPrice());
        }
    }

    public record NavigationView(List<DimensionView> position, int recordCount, BigDecimal totalRevenue, List<RowView> rows) {

        static NavigationView of(NavigationResult result) {
            BigDecimal revenue = result.detailRows().stream()
                    .map(r -> r.measures().revenue())
                    .reduce(BigDecimal.ZERO, BigDecimal::add);
            return new NavigationView(positionOf(result.position()), result.detailRows().size(), revenue,
                    result.detailRows().stream().map(RowView::of).toList());
        }
    }

    public record GroupView(String level, int count, List<RowView> rows) {}

    public record AnalysisView(String mode, List<String> levels, String filter, int totalRecords,
                               List<GroupView> groups, CrossTab crossTab) {

        static AnalysisView of(AggregationResult result) {
            List<GroupView> groups = new ArrayList<>();
            result.groups().forEach((level, rows) ->
                    groups.add(new GroupView(level.label(), rows.size(), rows.stream().map(RowView::of).toList())));
            return new AnalysisView(result.request().mode().name(),
                    result.request().levels().stream().map(HierarchyLevel::name).toList(),
                    result.request().hasFilter() ? result.request().filter().toString() : null,
                    result.rowCount(), groups, result.crossTab());
        }
    }

    static List<DimensionView> positionOf(Position position) {
        return position.dimensions().stream()
                .map(p -> new DimensionView(p.dimension().key(), p.levelName(), p.rank(), p.maxRank(),
                        !p.isMostDetailed(), !p.isMostAggregated()))
                .toList();
    }
}
