package de.caluga.golden.field;

import de.caluga.golden.CasingPolicy;
import de.caluga.golden.codec.EnumCodec;

/**
 * Enum constants by name. Knows the casing policy of its mapper: unless bound to an explicit attribute, it
 * reads the attribute named like its external name converted back - and falls back to the field name when
 * the source has no such attribute.
 */
@SuppressWarnings("rawtypes")
public class EnumField extends ValueField<Enum> {

    private final CasingPolicy casing;

    public EnumField(EnumCodec codec, CasingPolicy casing) {
        super(codec);
        this.casing = casing;
    }

    private EnumField(EnumCodec codec, CasingPolicy casing, String attribute, boolean required, boolean allowNull, boolean dumpOnly, boolean loadOnly) {
        super(codec, attribute, required, allowNull, dumpOnly, loadOnly);
        this.casing = casing;
    }

    public CasingPolicy getCasing() {
        return casing;
    }

    @Override
    protected MappedField copy(String attribute, boolean required, boolean allowNull, boolean dumpOnly, boolean loadOnly) {
        return new EnumField((EnumCodec) getCodec(), casing, attribute, required, allowNull, dumpOnly, loadOnly);
    }

    @Override
    public Object extract(Object source, AttributeReader reader, String fieldName, String externalName) {
        if (getAttribute() != null) {
            return reader.read(source, getAttribute());
        }

        String attr = casing.toInternal(externalName);

        if (!attr.equals(fieldName) && !reader.hasAttribute(source, attr)) {
            attr = fieldName;
        }

        return reader.read(source, attr);
    }
}
