package org.iceforge.runa.olap.model;

/**
 * Label attached to a classified aggregate row. Implemented by {@link CubeLevel} and {@link GroupingSet}.
 */
public interface AggregationLevel {

    String label();

    GroupingFlags flags();

    boolean isDetail();
}
