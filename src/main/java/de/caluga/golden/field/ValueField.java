package de.caluga.golden.field;

import de.caluga.golden.codec.TypeCodec;

/**
 * field converting its value with a {@link TypeCodec}
 */
@SuppressWarnings("unchecked")
public class ValueField<T> extends MappedField {

    private final TypeCodec<T> codec;

    public ValueField(TypeCodec<T> codec) {
        this.codec = codec;
    }

    protected ValueField(TypeCodec<T> codec, String attribute, boolean required, boolean allowNull, boolean dumpOnly, boolean loadOnly) {
        super(attribute, required, allowNull, dumpOnly, loadOnly);
        this.codec = codec;
    }

    public TypeCodec<T> getCodec() {
        return codec;
    }

    @Override
    protected MappedField copy(String attribute, boolean required, boolean allowNull, boolean dumpOnly, boolean loadOnly) {
        return new ValueField<>(codec, attribute, required, allowNull, dumpOnly, loadOnly);
    }

    @Override
    public Object serialize(Object value) {
        return codec.marshall((T) value);
    }

    @Override
    public Object deserialize(Object raw) {
        return codec.unmarshall(raw);
    }
}
