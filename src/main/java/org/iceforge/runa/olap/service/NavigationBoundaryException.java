package org.iceforge.runa.olap.service;

import org.iceforge.runa.olap.model.Dimension;

/**
 * A drill-down or roll-up that would leave the hierarchy. The navigation state is left as it was.
 */
public class NavigationBoundaryException extends RuntimeException {

    public enum Boundary {
        MOST_DETAILED,
        MOST_AGGREGATED
    }

    private final Dimension dimension;
    private final Boundary boundary;

    public NavigationBoundaryException(Dimension dimension, Boundary boundary, String levelName) {
        super(message(dimension, boundary, levelName));
        this.dimension = dimension;
        this.boundary = boundary;
    }

    public Dimension getDimension() {
        return dimension;
    }

    public Boundary getBoundary() {
        return boundary;
    }

    private static String message(Dimension dimension, Boundary boundary, String levelName) {
        return switch (boundary) {
            case MOST_DETAILED -> dimension.key() + " is already at its most detailed level (" + levelName + ")";
            case MOST_AGGREGATED -> dimension.key() + " is already at its most aggregated level (" + levelName + ")";
        };
    }
}
