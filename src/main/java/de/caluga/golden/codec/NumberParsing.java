package de.caluga.golden.codec;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class NumberParsing {

    private NumberParsing() {
    }

    /**
     * @throws NumberFormatException if d is neither a number nor a numeric string
     * @throws ArithmeticException   if d has a fractional part
     */
    static BigDecimal toIntegral(Object d) {
        BigDecimal v;

        if (d instanceof Boolean) {
            throw new NumberFormatException("boolean");
        } else if (d instanceof Number) {
            v = new BigDecimal(d.toString());
        } else if (d instanceof String) {
            v = new BigDecimal(((String) d).trim());
        } else {
            throw new NumberFormatException(String.valueOf(d));
        }

        return v.setScale(0, RoundingMode.UNNECESSARY);
    }
}
