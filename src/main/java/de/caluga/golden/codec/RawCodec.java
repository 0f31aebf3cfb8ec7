package de.caluga.golden.codec;

/**
 * passes values through unchanged - for attributes holding plain json structures
 */
public class RawCodec implements TypeCodec<Object> {

    @Override
    public Object marshall(Object o) {
        return o;
    }

    @Override
    public Object unmarshall(Object d) {
        return d;
    }
}
