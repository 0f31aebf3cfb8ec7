package de.caluga.golden.codec;

/**
 * Converts values of one type to their json compatible representation and back.
 * <p>
 * {@code unmarshall} signals values it cannot convert with an {@link IllegalArgumentException} - its
 * message ends up in the validation errors, so keep it readable.
 *
 * @param <T> the java type handled
 */
public interface TypeCodec<T> {

    /**
     * @param o value to convert, never null
     */
    Object marshall(T o);

    /**
     * @param d value from the serialized data, never null
     */
    T unmarshall(Object d);
}
