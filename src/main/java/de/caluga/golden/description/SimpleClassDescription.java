package de.caluga.golden.description;

import de.caluga.golden.InvalidConfigurationException;
import de.caluga.golden.ReflectionHelper;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Class description with an explicit attribute list. New instances are created by a factory that gets
 * all values by name, like a constructor with named arguments.
 *
 * <pre>
 * SimpleClassDescription.builder(Point.class)
 *     .attribute(AttributeDescriptor.of("x", AttributeType.INTEGER, false))
 *     .attribute(AttributeDescriptor.of("y", AttributeType.INTEGER, false))
 *     .factory(values -&gt; new Point((Integer) values.get("x"), (Integer) values.get("y")))
 *     .build();
 * </pre>
 *
 * @param <T> described class
 */
public class SimpleClassDescription<T> implements ClassDescription<T> {

    private final ReflectionHelper reflection = new ReflectionHelper();
    private final Class<T> type;
    private final List<AttributeDescriptor> attributes;
    private final String identityAttribute;
    private final Function<Map<String, Object>, ? extends T> factory;

    private SimpleClassDescription(Builder<T> b) {
        this.type = b.type;
        this.attributes = Collections.unmodifiableList(new ArrayList<>(b.attributes.values()));
        this.identityAttribute = b.identityAttribute;
        this.factory = b.factory;
    }

    public static <T> Builder<T> builder(Class<T> type) {
        return new Builder<>(type);
    }

    @Override
    public Class<T> getType() {
        return type;
    }

    @Override
    public List<AttributeDescriptor> getAttributes() {
        return attributes;
    }

    @Override
    public String getIdentityAttribute() {
        return identityAttribute;
    }

    @Override
    public Object getValue(Object instance, String attribute) {
        return reflection.getValue(instance, attribute);
    }

    @Override
    public T newInstance(Map<String, Object> values) {
        T ret;

        try {
            ret = factory.apply(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
        } catch (ClassCastException | IllegalArgumentException e) {
            throw new InvalidConfigurationException("Factory of " + type.getSimpleName() + " rejected " + values.keySet(), e);
        }

        if (ret == null) {
            throw new InvalidConfigurationException("Factory of " + type.getSimpleName() + " returned null");
        }

        return ret;
    }

    public static class Builder<T> {
        private final Class<T> type;
        private final Map<String, AttributeDescriptor> attributes = new LinkedHashMap<>();
        private String identityAttribute = DEFAULT_IDENTITY_ATTRIBUTE;
        private Function<Map<String, Object>, ? extends T> factory;

        private Builder(Class<T> type) {
            if (type == null) {
                throw new IllegalArgumentException("type must not be null");
            }

            this.type = type;
        }

        public Builder<T> attribute(AttributeDescriptor a) {
            if (attributes.putIfAbsent(a.getName(), a) != null) {
                throw new InvalidConfigurationException("Attribute '" + a.getName() + "' declared twice for " + type.getSimpleName());
            }

            return this;
        }

        public Builder<T> identityAttribute(String name) {
            identityAttribute = name;
            return this;
        }

        public Builder<T> factory(Function<Map<String, Object>, ? extends T> f) {
            factory = f;
            return this;
        }

        public SimpleClassDescription<T> build() {
            if (factory == null) {
                throw new InvalidConfigurationException("No factory given for " + type.getSimpleName());
            }

            return new SimpleClassDescription<>(this);
        }
    }
}
