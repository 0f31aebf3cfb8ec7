package de.caluga.golden;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Converts names between snake_case and camelCase.
 * <p>
 * {@link #toSnake(String)} is a heuristic: it only inserts an underscore in front of an upper case letter
 * that follows at least one non upper case character and is not the last character. So {@code fieldA}
 * becomes {@code fielda} and {@code parseHTTPRequest} becomes {@code parse_httprequest}. Only names made of
 * lower case words with at least two letters survive {@code toSnake(toCamel(n))} unchanged.
 */
public final class CaseConverter {

    private static final Pattern CAMEL_HUMP = Pattern.compile("([^A-Z]+?)([A-Z])(.)");

    private CaseConverter() {
    }

    /**
     * turns document_id into documentId
     *
     * @param n - name to convert
     * @return the name unchanged if it contains no underscore, else the first segment followed by every
     * further segment capitalized. Empty segments are dropped.
     */
    public static String toCamel(String n) {
        if (n == null) {
            throw new IllegalArgumentException("name must not be null");
        }

        if (n.indexOf('_') < 0) {
            return n;
        }

        String[] f = n.split("_", -1);
        StringBuilder sb = new StringBuilder(f[0]);

        for (int i = 1; i < f.length; i++) {
            sb.append(capitalize(f[i]));
        }

        return sb.toString();
    }

    /**
     * turns documentId into document_id
     *
     * @param n - name to convert
     * @return converted string, always lower case
     */
    public static String toSnake(String n) {
        if (n == null) {
            throw new IllegalArgumentException("name must not be null");
        }

        return CAMEL_HUMP.matcher(n).replaceAll("$1_$2$3").toLowerCase(Locale.ROOT);
    }

    private static String capitalize(String s) {
        if (s.isEmpty()) {
            return s;
        }

        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1).toLowerCase(Locale.ROOT);
    }
}
