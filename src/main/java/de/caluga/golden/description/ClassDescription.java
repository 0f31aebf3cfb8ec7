package de.caluga.golden.description;

import java.util.List;
import java.util.Map;

/**
 * Everything a mapper needs to know about a class: its ordered attributes, how to read them from an
 * instance and how to create a new instance from named values.
 *
 * @param <T> described class
 */
public interface ClassDescription<T> {

    String DEFAULT_IDENTITY_ATTRIBUTE = "id";

    Class<T> getType();

    default String getName() {
        return getType().getSimpleName();
    }

    /**
     * @return attributes in declaration order
     */
    List<AttributeDescriptor> getAttributes();

    default AttributeDescriptor getAttribute(String name) {
        for (AttributeDescriptor a : getAttributes()) {
            if (a.getName().equals(name)) {
                return a;
            }
        }

        return null;
    }

    default String getIdentityAttribute() {
        return DEFAULT_IDENTITY_ATTRIBUTE;
    }

    /**
     * reads an attribute (or relation) value from an instance
     *
     * @throws de.caluga.golden.InvalidConfigurationException if the instance does not have that attribute
     */
    Object getValue(Object instance, String attribute);

    /**
     * creates a new instance. All entries of the map are passed on, nothing is dropped silently.
     *
     * @param attributes attribute and relation values, keyed by attribute name
     * @throws de.caluga.golden.InvalidConfigurationException if the class cannot accept one of the values
     */
    T newInstance(Map<String, Object> attributes);
}
