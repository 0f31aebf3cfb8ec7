package de.caluga.golden;

import de.caluga.golden.description.AttributeType;

/**
 * thrown when no codec can be found for the declared type of an attribute
 */
public class UnsupportedTypeException extends InvalidConfigurationException {

    private final String attribute;
    private final AttributeType type;

    public UnsupportedTypeException(String attribute, AttributeType type, String msg) {
        super("Unsupported type " + type + " for attribute '" + attribute + "': " + msg);
        this.attribute = attribute;
        this.type = type;
    }

    public String getAttribute() {
        return attribute;
    }

    public AttributeType getType() {
        return type;
    }
}
