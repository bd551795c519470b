package org.iceforge.runa.olap.model;

/**
 * Measure a cross-tab is built on.
 */
public enum Measure {
    QUANTITY(true),
    REVENUE(false),
    TRANSACTION_COUNT(true);

    private final boolean integral;

    Measure(boolean integral) {
        this.integral = integral;
    }

    /**
     * Integral measures must reconcile exactly; monetary ones within a tolerance.
     */
    public boolean isIntegral() {
        return integral;
    }
}
