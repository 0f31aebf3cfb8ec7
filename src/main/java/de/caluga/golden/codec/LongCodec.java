package de.caluga.golden.codec;

public class LongCodec implements TypeCodec<Number> {

    @Override
    public Object marshall(Number o) {
        try {
            return NumberParsing.toIntegral(o).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException(o + " does not fit into a long", e);
        }
    }

    @Override
    public Long unmarshall(Object d) {
        try {
            return NumberParsing.toIntegral(d).longValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new IllegalArgumentException("Not a valid integer.", e);
        }
    }
}
