package de.caluga.golden.field;

import java.util.function.Function;

/**
 * Computed value, only written on serialization. The function gets the whole source object and has to
 * return a json compatible value.
 */
public class MethodField extends MappedField {

    private final Function<Object, Object> method;

    public MethodField(Function<Object, Object> method) {
        this(method, false, false);
    }

    private MethodField(Function<Object, Object> method, boolean required, boolean allowNull) {
        super(null, required, allowNull, true, false);
        this.method = method;
    }

    @Override
    protected MappedField copy(String attribute, boolean required, boolean allowNull, boolean dumpOnly, boolean loadOnly) {
        if (attribute != null || loadOnly) {
            throw new UnsupportedOperationException("method fields are computed and dump only");
        }

        return new MethodField(method, required, allowNull);
    }

    @Override
    public Object extract(Object source, AttributeReader reader, String fieldName, String externalName) {
        return method.apply(source);
    }

    @Override
    public Object serialize(Object value) {
        return value;
    }

    @Override
    public Object deserialize(Object raw) {
        throw new UnsupportedOperationException("method fields are not deserialized");
    }
}
