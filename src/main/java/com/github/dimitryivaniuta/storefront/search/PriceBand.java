package com.github.dimitryivaniuta.storefront.search;

import java.math.BigDecimal;

/**
 * Price expectations expressed in a query. Bounds are in the catalog currency;
 * the upper bound is exclusive and absent for {@link #VERY_HIGH}.
 */
public enum PriceBand {
    VERY_LOW(0, 150),
    LOW(150, 350),
    MEDIUM(350, 650),
    HIGH(650, 1200),
    VERY_HIGH(1200, -1);

    private final BigDecimal min;
    private final BigDecimal max;

    PriceBand(long min, long max) {
        this.min = BigDecimal.valueOf(min);
        this.max = max < 0 ? null : BigDecimal.valueOf(max);
    }

    public BigDecimal min() {
        return min;
    }

    public BigDecimal max() {
        return max;
    }

    /**
     * @param upperTolerance fraction added to the upper bound, e.g. 0.2 accepts 20% above it
     */
    public boolean accepts(BigDecimal price, double upperTolerance) {
        if (price == null || price.compareTo(min) < 0) {
            return false;
        }
        if (max == null) {
            return true;
        }
        BigDecimal ceiling = max.multiply(BigDecimal.valueOf(1.0 + upperTolerance));
        return price.compareTo(ceiling) < 0;
    }
}
