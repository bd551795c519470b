package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.model.AggregationMode;
import org.iceforge.runa.olap.model.AggregationRequest;
import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.model.EqualityFilter;
import org.iceforge.runa.olap.model.GroupingSet;
import org.iceforge.runa.olap.model.HierarchyLevel;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Service
public class AggregationRequestBuilder {

    private final HierarchyCatalog catalog;

    public AggregationRequestBuilder(HierarchyCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog);
    }

    public AggregationRequest cube(NavigationState state, EqualityFilter filter) {
        return build(AggregationMode.CUBE, levelsAt(state), filter);
    }

    public AggregationRequest groupingSets(NavigationState state, EqualityFilter filter) {
        return build(AggregationMode.GROUPING_SETS, levelsAt(state), filter);
    }

    /**
     * @param levels one level per dimension, in {@link Dimension} order
     */
    public AggregationRequest build(AggregationMode mode, List<HierarchyLevel> levels, EqualityFilter filter) {
        Objects.requireNonNull(mode);
        return switch (mode) {
            // subsets are left to the engine's CUBE primitive
            case CUBE -> new AggregationRequest(mode, levels, List.of(), filter);
            case GROUPING_SETS -> new AggregationRequest(mode, levels, List.of(GroupingSet.values()), filter);
        };
    }

    /**
     * Resolves level names (or aliases) of all three dimensions.
     *
     * @throws UnknownLevelException for any name the catalog does not know
     */
    public List<HierarchyLevel> levels(String geo, String time, String product) {
        return List.of(
                catalog.level(Dimension.GEOGRAPHY, geo),
                catalog.level(Dimension.TIME, time),
                catalog.level(Dimension.PRODUCT, product));
    }

    public List<HierarchyLevel> levelsAt(NavigationState state) {
        List<HierarchyLevel> levels = new ArrayList<>(3);
        for (Dimension d : Dimension.values()) {
            levels.add(catalog.level(d, state.rank(d)));
        }
        return levels;
    }

    /**
     * Equality filter on a level found in any hierarchy, e.g. {@code filter("Year", 2019)}.
     *
     * @return {@code null} when no level is given
     * @throws UnknownLevelException if no hierarchy has the level
     */
    public EqualityFilter filter(String levelName, Object value) {
        if (levelName == null || levelName.isBlank()) {
            return null;
        }
        if (value == null) {
            throw new IllegalArgumentException("Filter on '" + levelName + "' has no value");
        }
        Dimension d = catalog.dimensionOfLevel(levelName);
        return new EqualityFilter(d, catalog.level(d, levelName), value);
    }
}
