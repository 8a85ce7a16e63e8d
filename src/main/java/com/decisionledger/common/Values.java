package com.decisionledger.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Objects;

/**
 * Comparison helpers for JSON-shaped values, where 720, 720L and 720.0 must
 * compare equal.
 */
public final class Values {

    private Values() {
    }

    public static boolean looselyEqual(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return compareNumbers(l, r) == 0;
        }
        return Objects.equals(left, right);
    }

    public static int compareNumbers(Number left, Number right) {
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    public static BigDecimal toBigDecimal(Number number) {
        if (number instanceof BigDecimal decimal) {
            return decimal;
        }
        if (number instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (number instanceof Integer || number instanceof Long
            || number instanceof Short || number instanceof Byte) {
            return BigDecimal.valueOf(number.longValue());
        }
        return new BigDecimal(Double.toString(number.doubleValue()));
    }

    public static boolean isIntegral(Object value) {
        return value instanceof Integer || value instanceof Long
            || value instanceof Short || value instanceof Byte || value instanceof BigInteger;
    }
}
