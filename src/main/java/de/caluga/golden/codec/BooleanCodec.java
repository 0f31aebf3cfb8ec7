package de.caluga.golden.codec;

import java.util.Locale;
import java.util.Set;

/**
 * besides booleans, accepts the usual textual and numeric spellings (true/false, on/off, 1/0, ...)
 */
public class BooleanCodec implements TypeCodec<Boolean> {

    private static final Set<String> TRUTHY = Set.of("t", "true", "on", "y", "yes", "1");
    private static final Set<String> FALSY = Set.of("f", "false", "off", "n", "no", "0");

    @Override
    public Object marshall(Boolean o) {
        return o;
    }

    @Override
    public Boolean unmarshall(Object d) {
        if (d instanceof Boolean) {
            return (Boolean) d;
        }

        String s = null;

        if (d instanceof String) {
            s = ((String) d).trim().toLowerCase(Locale.ROOT);
        } else if (d instanceof Integer || d instanceof Long || d instanceof Short || d instanceof Byte) {
            s = d.toString();
        }

        if (s != null) {
            if (TRUTHY.contains(s)) {
                return Boolean.TRUE;
            }

            if (FALSY.contains(s)) {
                return Boolean.FALSE;
            }
        }

        throw new IllegalArgumentException("Not a valid boolean.");
    }
}
