package de.caluga.golden.field;

/**
 * One conversion rule between an object attribute and a key of the serialized data.
 * <p>
 * Fields are immutable. The methods configuring them ({@link #required()}, {@link #attribute(String)}, ...)
 * return modified copies. A field does not know its own name - the mapper holding it does, together with
 * the external (case converted) name.
 */
public abstract class MappedField {

    private final String attribute;
    private final boolean required;
    private final boolean allowNull;
    private final boolean dumpOnly;
    private final boolean loadOnly;

    protected MappedField() {
        this(null, false, false, false, false);
    }

    protected MappedField(String attribute, boolean required, boolean allowNull, boolean dumpOnly, boolean loadOnly) {
        if (dumpOnly && loadOnly) {
            throw new IllegalArgumentException("field cannot be dump only and load only");
        }

        this.attribute = attribute;
        this.required = required;
        this.allowNull = allowNull;
        this.dumpOnly = dumpOnly;
        this.loadOnly = loadOnly;
    }

    /**
     * @return a copy of this field with the given settings
     */
    protected abstract MappedField copy(String attribute, boolean required, boolean allowNull, boolean dumpOnly, boolean loadOnly);

    /**
     * converts an attribute value to its serialized form
     *
     * @param value never null
     */
    public abstract Object serialize(Object value);

    /**
     * converts a value of the serialized data
     *
     * @param raw never null
     * @throws IllegalArgumentException                 if the value cannot be converted
     * @throws de.caluga.golden.ValidationException if a nested structure has errors, keys relative to this field
     */
    public abstract Object deserialize(Object raw);

    /**
     * reads the value to serialize from the source object
     *
     * @param fieldName    name of this field in the mapper
     * @param externalName the name it is serialized under
     */
    public Object extract(Object source, AttributeReader reader, String fieldName, String externalName) {
        return reader.read(source, attributeFor(fieldName));
    }

    /**
     * @return the explicitly bound attribute, null if the field name is used
     */
    public String getAttribute() {
        return attribute;
    }

    public String attributeFor(String fieldName) {
        return attribute != null ? attribute : fieldName;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean isAllowNull() {
        return allowNull;
    }

    public boolean isDumpOnly() {
        return dumpOnly;
    }

    public boolean isLoadOnly() {
        return loadOnly;
    }

    public MappedField attribute(String attr) {
        return copy(attr, required, allowNull, dumpOnly, loadOnly);
    }

    public MappedField required() {
        return copy(attribute, true, allowNull, dumpOnly, loadOnly);
    }

    public MappedField allowNull() {
        return copy(attribute, required, true, dumpOnly, loadOnly);
    }

    /**
     * required and not nullable - or neither
     */
    public MappedField nullable(boolean nullable) {
        return copy(attribute, !nullable, nullable, dumpOnly, loadOnly);
    }

    public MappedField dumpOnly() {
        return copy(attribute, required, allowNull, true, false);
    }

    public MappedField loadOnly() {
        return copy(attribute, required, allowNull, false, true);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + (attribute != null ? "attribute=" + attribute + ", " : "") + "required=" + required + ", allowNull=" + allowNull + (dumpOnly ? ", dumpOnly" : "") + (loadOnly ? ", loadOnly" : "") + "}";
    }
}
