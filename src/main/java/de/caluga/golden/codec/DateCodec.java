package de.caluga.golden.codec;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * ISO-8601 dates, e.g. 2024-02-29
 */
public class DateCodec implements TypeCodec<LocalDate> {

    @Override
    public Object marshall(LocalDate o) {
        return o.toString();
    }

    @Override
    public LocalDate unmarshall(Object d) {
        if (d instanceof LocalDate) {
            return (LocalDate) d;
        }

        if (d instanceof String) {
            try {
                return LocalDate.parse((String) d);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Not a valid date.", e);
            }
        }

        throw new IllegalArgumentException("Not a valid date.");
    }
}
