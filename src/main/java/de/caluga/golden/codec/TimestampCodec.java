package de.caluga.golden.codec;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * Timestamps as ISO-8601 strings. The java type is fixed per attribute: {@link LocalDateTime} (default),
 * {@link Instant}, {@link OffsetDateTime}, {@link ZonedDateTime} or {@link Date}. Timestamps with offset are
 * accepted for {@link LocalDateTime} attributes and converted to UTC.
 */
public class TimestampCodec implements TypeCodec<Object> {

    private final Class<?> targetClass;

    public TimestampCodec() {
        this(LocalDateTime.class);
    }

    public TimestampCodec(Class<?> targetClass) {
        if (!isSupported(targetClass)) {
            throw new IllegalArgumentException("Not a timestamp class: " + targetClass);
        }

        this.targetClass = targetClass;
    }

    public static boolean isSupported(Class<?> cls) {
        return LocalDateTime.class.equals(cls) || Instant.class.equals(cls) || OffsetDateTime.class.equals(cls)
            || ZonedDateTime.class.equals(cls) || Date.class.equals(cls);
    }

    public Class<?> getTargetClass() {
        return targetClass;
    }

    @Override
    public Object marshall(Object o) {
        if (o instanceof LocalDateTime) {
            return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((LocalDateTime) o);
        } else if (o instanceof OffsetDateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((OffsetDateTime) o);
        } else if (o instanceof ZonedDateTime) {
            return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((ZonedDateTime) o);
        } else if (o instanceof Instant) {
            return o.toString();
        } else if (o instanceof Date) {
            return ((Date) o).toInstant().toString();
        }

        throw new IllegalArgumentException("Not a timestamp: " + o.getClass().getName());
    }

    @Override
    public Object unmarshall(Object d) {
        if (targetClass.isInstance(d)) {
            return d;
        }

        if (!(d instanceof String)) {
            throw new IllegalArgumentException("Not a valid datetime.");
        }

        String s = (String) d;

        try {
            if (LocalDateTime.class.equals(targetClass)) {
                return parseLocal(s);
            } else if (OffsetDateTime.class.equals(targetClass)) {
                return OffsetDateTime.parse(s);
            } else if (ZonedDateTime.class.equals(targetClass)) {
                return ZonedDateTime.parse(s);
            } else if (Instant.class.equals(targetClass)) {
                return OffsetDateTime.parse(s).toInstant();
            }

            return Date.from(OffsetDateTime.parse(s).toInstant());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Not a valid datetime.", e);
        }
    }

    private static LocalDateTime parseLocal(String s) {
        try {
            return LocalDateTime.parse(s);
        } catch (DateTimeParseException e) {
            return OffsetDateTime.parse(s).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
        }
    }
}
