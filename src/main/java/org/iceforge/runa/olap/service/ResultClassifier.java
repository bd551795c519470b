package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.model.AggregateRow;
import org.iceforge.runa.olap.model.AggregationLevel;
import org.iceforge.runa.olap.model.AggregationMode;
import org.iceforge.runa.olap.model.AggregationRequest;
import org.iceforge.runa.olap.model.ClassifiedRow;
import org.iceforge.runa.olap.model.CubeLevel;
import org.iceforge.runa.olap.model.GroupingSet;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Labels aggregate rows by the dimensions they collapse.
 *
 * <p>Only the grouping flags are consulted. Dimension values are never inspected, so a {@code null} that is real
 * data stays in the detail level.
 */
@Service
public class ResultClassifier {

    public List<ClassifiedRow> classify(AggregationRequest request, List<AggregateRow> rows) {
        List<ClassifiedRow> out = new ArrayList<>(rows.size());
        for (AggregateRow row : rows) {
            out.add(new ClassifiedRow(row, levelOf(request, row)));
        }
        return out;
    }

    public AggregationLevel levelOf(AggregationRequest request, AggregateRow row) {
        if (request.mode() == AggregationMode.CUBE) {
            return CubeLevel.of(row.flags());
        }
        for (GroupingSet set : request.groupingSets()) {
            if (set.flags().equals(row.flags())) {
                return set;
            }
        }
        throw new AggregationExecutionException("Row with grouping flags " + row.flags()
                + " was not produced by any requested grouping set " + request.groupingSets());
    }

    /**
     * Groups classified rows by level. Levels appear in declaration order; levels without rows are left out.
     */
    public Map<AggregationLevel, List<ClassifiedRow>> group(AggregationMode mode, List<ClassifiedRow> rows) {
        AggregationLevel[] order = mode == AggregationMode.CUBE ? CubeLevel.values() : GroupingSet.values();
        Map<AggregationLevel, List<ClassifiedRow>> groups = new LinkedHashMap<>();
        for (AggregationLevel level : order) {
            List<ClassifiedRow> matching = rows.stream().filter(r -> r.level() == level).toList();
            if (!matching.isEmpty()) {
                groups.put(level, matching);
            }
        }
        return groups;
    }
}
