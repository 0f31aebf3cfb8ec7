package de.caluga.golden.description;

/**
 * The declared type of an attribute. Each type except {@link #NESTED_REFERENCE} and {@link #AUTO} has a
 * codec in {@link de.caluga.golden.codec.CodecRegistry}.
 */
public enum AttributeType {
    STRING,
    INTEGER,
    LONG,
    TIMESTAMP,
    DATE,
    BOOLEAN,
    ENUM,
    UUID,
    /**
     * json value, passed on as is
     */
    RAW,
    /**
     * list of values of one scalar element type
     */
    ARRAY,
    /**
     * reference to another described class - only mapped through a nested relation
     */
    NESTED_REFERENCE,
    /**
     * not a type - placeholder in annotations meaning "derive it from the java type"
     */
    AUTO;

    public boolean isScalar() {
        return this != ARRAY && this != NESTED_REFERENCE && this != AUTO;
    }
}
