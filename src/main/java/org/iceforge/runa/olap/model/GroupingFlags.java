package org.iceforge.runa.olap.model;

/**
 * Per-dimension collapse markers of one aggregate row, as reported by the engine's {@code GROUPING()} function.
 * {@code true} means the dimension was aggregated away.
 */
public record GroupingFlags(boolean geo, boolean time, boolean product) {

    public boolean isCollapsed(Dimension dimension) {
        return switch (dimension) {
            case GEOGRAPHY -> geo;
            case TIME -> time;
            case PRODUCT -> product;
        };
    }

    /**
     * geo is the high bit: {@code geo<<2 | time<<1 | product}.
     */
    public int bitmask() {
        return (geo ? 4 : 0) | (time ? 2 : 0) | (product ? 1 : 0);
    }

    public static GroupingFlags fromBitmask(int mask) {
        if (mask < 0 || mask > 7) {
            throw new IllegalArgumentException("Grouping bitmask out of range: " + mask);
        }
        return new GroupingFlags((mask & 4) != 0, (mask & 2) != 0, (mask & 1) != 0);
    }

    @Override
    public String toString() {
        return "" + (geo ? 1 : 0) + (time ? 1 : 0) + (product ? 1 : 0);
    }
}
