package com.flagship.storefront_payments.gateway;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion between major currency units (what orders store) and the integer minor
 * units the gateway speaks. Exact for any amount with at most two decimals.
 */
public final class MinorUnits {

    private static final int SCALE = 2;

    private MinorUnits() {
    }

    /**
     * @throws ArithmeticException if the amount does not fit in a long
     */
    public static long toMinor(BigDecimal majorUnits) {
        if (majorUnits == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        return majorUnits.movePointRight(SCALE)
            .setScale(0, RoundingMode.HALF_UP)
            .longValueExact();
    }

    public static BigDecimal toMajor(long minorUnits) {
        return BigDecimal.valueOf(minorUnits, SCALE);
    }
}
