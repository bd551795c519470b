package org.iceforge.runa.olap.model;

import java.util.List;

/**
 * Outcome of a successful drill-down or roll-up: the new position and the rows at its granularity.
 */
public record NavigationResult(Position position, List<ClassifiedRow> detailRows) {

    public NavigationResult {
        detailRows = List.copyOf(detailRows);
    }
}
