package de.caluga.golden.codec;

/**
 * enum constants are written as their name, not their ordinal
 */
@SuppressWarnings({"rawtypes", "unchecked"})
public class EnumCodec implements TypeCodec<Enum> {

    private final Class<? extends Enum> enumType;

    public EnumCodec(Class<? extends Enum> enumType) {
        if (enumType == null || !enumType.isEnum()) {
            throw new IllegalArgumentException("Not an enum: " + enumType);
        }

        this.enumType = enumType;
    }

    public Class<? extends Enum> getEnumType() {
        return enumType;
    }

    @Override
    public Object marshall(Enum o) {
        return o.name();
    }

    @Override
    public Enum unmarshall(Object d) {
        if (enumType.isInstance(d)) {
            return (Enum) d;
        }

        if (d instanceof String) {
            try {
                return Enum.valueOf(enumType, (String) d);
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Not a valid choice: '" + d + "'.", e);
            }
        }

        throw new IllegalArgumentException("Not a valid choice: '" + d + "'.");
    }
}
