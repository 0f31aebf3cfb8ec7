package de.caluga.golden.codec;

import java.util.UUID;

public class UuidCodec implements TypeCodec<UUID> {

    @Override
    public Object marshall(UUID o) {
        return o.toString();
    }

    @Override
    public UUID unmarshall(Object d) {
        if (d instanceof UUID) {
            return (UUID) d;
        }

        if (d instanceof String) {
            try {
                return UUID.fromString((String) d);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Not a valid UUID.", e);
            }
        }

        throw new IllegalArgumentException("Not a valid UUID.");
    }
}
