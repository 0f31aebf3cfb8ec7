package de.caluga.golden.field;

/**
 * Reads attribute values from the objects being serialized.
 */
public interface AttributeReader {

    Object read(Object source, String attribute);

    boolean hasAttribute(Object source, String attribute);
}
