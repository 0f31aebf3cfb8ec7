package de.caluga.golden.codec;

/**
 * accepts integral numbers and numeric strings, rejects fractions and values out of range
 */
public class IntegerCodec implements TypeCodec<Number> {

    @Override
    public Object marshall(Number o) {
        try {
            return NumberParsing.toIntegral(o).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException(o + " does not fit into an integer", e);
        }
    }

    @Override
    public Integer unmarshall(Object d) {
        try {
            return NumberParsing.toIntegral(d).intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Not a valid integer.", e);
        }
    }
}
