package org.iceforge.runa.olap.model;

public enum AggregationMode {
    /**
     * All 2^3 subsets of the three dimension columns, generated by the engine.
     */
    CUBE,
    /**
     * Exactly the subsets listed in {@link GroupingSet}.
     */
    GROUPING_SETS
}
