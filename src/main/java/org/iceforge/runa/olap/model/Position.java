package org.iceforge.runa.olap.model;

import java.util.List;

/**
 * Where a navigation session currently stands, one entry per dimension in {@link Dimension} order.
 */
public record Position(List<DimensionPosition> dimensions) {

    public Position {
        dimensions = List.copyOf(dimensions);
    }

    public DimensionPosition get(Dimension dimension) {
        return dimensions.get(dimension.ordinal());
    }

    public record DimensionPosition(Dimension dimension, String levelName, int rank, int maxRank) {

        public boolean isMostDetailed() {
            return rank == 0;
        }

        public boolean isMostAggregated() {
            return rank == maxRank;
        }
    }

    @Override
    public String toString() {
        return dimensions.stream().map(DimensionPosition::levelName).toList().toString();
    }
}
