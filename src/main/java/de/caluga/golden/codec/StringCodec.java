package de.caluga.golden.codec;

public class StringCodec implements TypeCodec<String> {

    @Override
    public Object marshall(String o) {
        return o;
    }

    @Override
    public String unmarshall(Object d) {
        if (!(d instanceof String)) {
            throw new IllegalArgumentException("Not a valid string.");
        }

        return (String) d;
    }
}
