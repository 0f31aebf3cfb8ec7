package de.caluga.golden.codec;

/**
 * integer attributes held in a short, written as plain integers
 */
public class ShortCodec implements TypeCodec<Number> {

    @Override
    public Object marshall(Number o) {
        try {
            return (int) NumberParsing.toIntegral(o).shortValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException(o + " does not fit into a short", e);
        }
    }

    @Override
    public Short unmarshall(Object d) {
        try {
            return NumberParsing.toIntegral(d).shortValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Not a valid integer.", e);
        }
    }
}
