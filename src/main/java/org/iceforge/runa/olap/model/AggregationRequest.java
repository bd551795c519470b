package org.iceforge.runa.olap.model;

import java.util.List;
import java.util.Objects;

/**
 * Engine-neutral description of one multi-level aggregation over the star schema.
 *
 * @param mode         cube or explicit grouping sets
 * @param levels       selected level per dimension, in {@link Dimension} order
 * @param groupingSets the explicit sets for {@link AggregationMode#GROUPING_SETS}, empty for a cube
 * @param filter       optional equality filter, may be {@code null}
 */
public record AggregationRequest(AggregationMode mode,
                                 List<HierarchyLevel> levels,
                                 List<GroupingSet> groupingSets,
                                 EqualityFilter filter) {

    public AggregationRequest {
        Objects.requireNonNull(mode, "mode");
        levels = List.copyOf(levels);
        groupingSets = groupingSets == null ? List.of() : List.copyOf(groupingSets);
        if (levels.size() != Dimension.values().length) {
            throw new IllegalArgumentException("Expected one level per dimension, got " + levels.size());
        }
        if (mode == AggregationMode.CUBE && !groupingSets.isEmpty()) {
            throw new IllegalArgumentException("A cube request does not enumerate grouping sets");
        }
        if (mode == AggregationMode.GROUPING_SETS && groupingSets.isEmpty()) {
            throw new IllegalArgumentException("A grouping-sets request needs at least one set");
        }
    }

    public HierarchyLevel level(Dimension dimension) {
        return levels.get(dimension.ordinal());
    }

    public List<String> dimensionColumns() {
        return levels.stream().map(HierarchyLevel::columnRef).toList();
    }

    public boolean hasFilter() {
        return filter != null;
    }

    @Override
    public String toString() {
        return mode.name() + levels.stream().map(HierarchyLevel::name).toList() + (filter == null ? "" : " where " + filter);
    }
}
