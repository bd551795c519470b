package org.iceforge.runa.olap.model;

/**
 * The eight aggregation levels of a three-dimension cube, keyed by collapse bitmask (geo, time, product).
 *
 * <p>The table is written out rather than derived from a power set. It is only valid for exactly three
 * dimensions; a cube over more dimensions needs its labels generated from the dimension list instead.
 */
public enum CubeLevel implements AggregationLevel {
    DETAIL("Detail Level", 0b000),
    BY_GEO_TIME("By Geo+Time", 0b001),
    BY_GEO_PRODUCT("By Geo+Product", 0b010),
    BY_TIME_PRODUCT("By Time+Product", 0b100),
    BY_GEOGRAPHY_ONLY("By Geography Only", 0b011),
    BY_TIME_ONLY("By Time Only", 0b101),
    BY_PRODUCT_ONLY("By Product Only", 0b110),
    GRAND_TOTAL("Grand Total", 0b111);

    private static final CubeLevel[] BY_MASK = new CubeLevel[8];

    static {
        for (CubeLevel level : values()) {
            if (BY_MASK[level.mask] != null) {
                throw new ExceptionInInitializerError("Duplicate cube bitmask " + level.mask);
            }
            BY_MASK[level.mask] = level;
        }
    }

    private final String label;
    private final int mask;

    CubeLevel(String label, int mask) {
        this.label = label;
        this.mask = mask;
    }

    @Override
    public String label() {
        return label;
    }

    @Override
    public GroupingFlags flags() {
        return GroupingFlags.fromBitmask(mask);
    }

    @Override
    public boolean isDetail() {
        return this == DETAIL;
    }

    public static CubeLevel of(GroupingFlags flags) {
        return BY_MASK[flags.bitmask()];
    }
}
