package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.model.Dimension;
import org.iceforge.runa.olap.service.NavigationBoundaryException.Boundary;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Current rank in each hierarchy. Owned by one session; not thread-safe.
 *
 * <p>Every operation either moves exactly one rank and returns, or throws {@link NavigationBoundaryException}
 * and leaves all ranks untouched.
 */
public class NavigationState {

    private final HierarchyCatalog catalog;
    private final Map<Dimension, Integer> ranks = new EnumMap<>(Dimension.class);

    public NavigationState(HierarchyCatalog catalog, int geoRank, int timeRank, int productRank) {
        this.catalog = Objects.requireNonNull(catalog);
        init(Dimension.GEOGRAPHY, geoRank);
        init(Dimension.TIME, timeRank);
        init(Dimension.PRODUCT, productRank);
    }

    private NavigationState(NavigationState other) {
        this.catalog = other.catalog;
        this.ranks.putAll(other.ranks);
    }

    private void init(Dimension dimension, int rank) {
        int max = catalog.maxRank(dimension);
        if (rank < 0 || rank > max) {
            throw new IllegalArgumentException("Initial " + dimension.key() + " rank " + rank + " outside [0, " + max + "]");
        }
        ranks.put(dimension, rank);
    }

    public int rank(Dimension dimension) {
        return ranks.get(dimension);
    }

    public int geoRank() {
        return rank(Dimension.GEOGRAPHY);
    }

    public int timeRank() {
        return rank(Dimension.TIME);
    }

    public int productRank() {
        return rank(Dimension.PRODUCT);
    }

    public boolean canDrillDown(Dimension dimension) {
        return rank(dimension) > 0;
    }

    public boolean canRollUp(Dimension dimension) {
        return rank(dimension) < catalog.maxRank(dimension);
    }

    /**
     * Moves one level towards the detail.
     *
     * @throws NavigationBoundaryException with {@link Boundary#MOST_DETAILED} at rank 0
     */
    public void drillDown(Dimension dimension) {
        if (!canDrillDown(dimension)) {
            throw new NavigationBoundaryException(dimension, Boundary.MOST_DETAILED, levelName(dimension));
        }
        ranks.put(dimension, rank(dimension) - 1);
    }

    /**
     * Moves one level towards the total.
     *
     * @throws NavigationBoundaryException with {@link Boundary#MOST_AGGREGATED} at the top rank
     */
    public void rollUp(Dimension dimension) {
        if (!canRollUp(dimension)) {
            throw new NavigationBoundaryException(dimension, Boundary.MOST_AGGREGATED, levelName(dimension));
        }
        ranks.put(dimension, rank(dimension) + 1);
    }

    public String levelName(Dimension dimension) {
        return catalog.level(dimension, rank(dimension)).name();
    }

    /**
     * Independent copy, used to try a move before committing it.
     */
    public NavigationState copy() {
        return new NavigationState(this);
    }

    /**
     * Takes over the ranks of a copy made with {@link #copy()}.
     */
    void commit(NavigationState moved) {
        if (moved.catalog != catalog) {
            throw new IllegalArgumentException("State belongs to another catalog");
        }
        ranks.putAll(moved.ranks);
    }

    @Override
    public String toString() {
        return "NavigationState" + ranks;
    }
}
