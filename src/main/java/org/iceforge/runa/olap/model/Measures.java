package org.iceforge.runa.olap.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Numeric measures of one aggregate row.
 *
 * @param avgUnitPrice average of revenue / quantity over the row's facts; {@code null} when no fact had a quantity
 */
public record Measures(long quantity, BigDecimal revenue, long count, BigDecimal avgUnitPrice) {

    public Measures {
        Objects.requireNonNull(revenue, "revenue");
    }

    public static Measures of(long quantity, String revenue, long count) {
        return new Measures(quantity, new BigDecimal(revenue), count, null);
    }

    /**
     * Builds measures from whatever numeric types the engine or the wire format produced.
     *
     * @throws NumberFormatException if a value is not a number
     * @throws ArithmeticException if a quantity or count is fractional or out of range
     */
    public static Measures fromNumbers(Object quantity, Object revenue, Object count, Object avgUnitPrice) {
        return new Measures(toLong(quantity), toDecimal(revenue, BigDecimal.ZERO), toLong(count), toDecimal(avgUnitPrice, null));
    }

    public BigDecimal value(Measure measure) {
        return switch (measure) {
            case QUANTITY -> BigDecimal.valueOf(quantity);
            case REVENUE -> revenue;
            case TRANSACTION_COUNT -> BigDecimal.valueOf(count);
        };
    }

    private static long toLong(Object v) {
        if (v == null) {
            // SUM over no rows
            return 0L;
        }
        if (v instanceof Long || v instanceof Integer || v instanceof Short || v instanceof Byte) {
            return ((Number) v).longValue();
        }
        if (v instanceof BigInteger b) {
            return b.longValueExact();
        }
        // counts and quantities must be whole: 1.5 fails rather than truncating
        return new BigDecimal(v.toString()).longValueExact();
    }

    private static BigDecimal toDecimal(Object v, BigDecimal ifNull) {
        if (v == null) {
            return ifNull;
        }
        if (v instanceof BigDecimal d) {
            return d;
        }
        return new BigDecimal(v.toString());
    }
}
