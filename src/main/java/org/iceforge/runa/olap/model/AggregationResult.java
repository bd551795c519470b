package org.iceforge.runa.olap.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classified rows of one request, grouped by level in the level's declaration order.
 *
 * @param crossTab only set for grouping-sets runs
 */
public record AggregationResult(AggregationRequest request,
                                Map<AggregationLevel, List<ClassifiedRow>> groups,
                                CrossTab crossTab) {

    public AggregationResult {
        Map<AggregationLevel, List<ClassifiedRow>> copy = new LinkedHashMap<>();
        groups.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        groups = Collections.unmodifiableMap(copy);
    }

    public List<ClassifiedRow> rows(AggregationLevel level) {
        return groups.getOrDefault(level, List.of());
    }

    public List<ClassifiedRow> detailRows() {
        List<ClassifiedRow> out = new ArrayList<>();
        groups.forEach((level, rows) -> {
            if (level.isDetail()) {
                out.addAll(rows);
            }
        });
        return out;
    }

    public int rowCount() {
        return groups.values().stream().mapToInt(List::size).sum();
    }
}
