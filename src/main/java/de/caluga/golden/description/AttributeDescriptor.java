package de.caluga.golden.description;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Name, declared type and nullability of one attribute of a described class.
 * <p>
 * The value class qualifies the type where needed: the enum class for {@link AttributeType#ENUM}, the
 * temporal class for {@link AttributeType#TIMESTAMP}. For {@link AttributeType#ARRAY} it qualifies the
 * element type.
 */
public final class AttributeDescriptor {

    private final String name;
    private final AttributeType type;
    private final AttributeType elementType;
    private final Class<?> valueClass;
    private final boolean nullable;

    private AttributeDescriptor(String name, AttributeType type, AttributeType elementType, Class<?> valueClass, boolean nullable) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("attribute name must not be empty");
        }

        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.elementType = elementType;
        this.valueClass = valueClass;
        this.nullable = nullable;
    }

    public static AttributeDescriptor of(String name, AttributeType type, boolean nullable) {
        return new AttributeDescriptor(name, type, null, defaultValueClass(type), nullable);
    }

    public static AttributeDescriptor of(String name, AttributeType type, Class<?> valueClass, boolean nullable) {
        return new AttributeDescriptor(name, type, null, valueClass, nullable);
    }

    public static AttributeDescriptor enumeration(String name, Class<? extends Enum<?>> enumType, boolean nullable) {
        return new AttributeDescriptor(name, AttributeType.ENUM, null, enumType, nullable);
    }

    public static AttributeDescriptor arrayOf(String name, AttributeType elementType, boolean nullable) {
        return new AttributeDescriptor(name, AttributeType.ARRAY, elementType, defaultValueClass(elementType), nullable);
    }

    public static AttributeDescriptor arrayOf(String name, AttributeType elementType, Class<?> elementClass, boolean nullable) {
        return new AttributeDescriptor(name, AttributeType.ARRAY, elementType, elementClass, nullable);
    }

    private static Class<?> defaultValueClass(AttributeType type) {
        if (type == null) {
            return null;
        }

        switch (type) {
            case STRING:
                return String.class;

            case INTEGER:
                return Integer.class;

            case LONG:
                return Long.class;

            case TIMESTAMP:
                return LocalDateTime.class;

            case DATE:
                return LocalDate.class;

            case BOOLEAN:
                return Boolean.class;

            case UUID:
                return java.util.UUID.class;

            default:
                return null;
        }
    }

    public String getName() {
        return name;
    }

    public AttributeType getType() {
        return type;
    }

    /**
     * @return element type of an array attribute, null for all other types
     */
    public AttributeType getElementType() {
        return elementType;
    }

    public Class<?> getValueClass() {
        return valueClass;
    }

    public boolean isNullable() {
        return nullable;
    }

    /**
     * descriptor of a single element of this array attribute
     */
    public AttributeDescriptor elementDescriptor() {
        if (type != AttributeType.ARRAY) {
            throw new IllegalStateException(name + " is not an array");
        }

        return new AttributeDescriptor(name, elementType == null ? AttributeType.AUTO : elementType, null, valueClass, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AttributeDescriptor that = (AttributeDescriptor) o;
        return nullable == that.nullable && name.equals(that.name) && type == that.type && elementType == that.elementType && Objects.equals(valueClass, that.valueClass);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, elementType, valueClass, nullable);
    }

    @Override
    public String toString() {
        return "AttributeDescriptor{" + name + ":" + type + (elementType != null ? "<" + elementType + ">" : "") + (nullable ? "" : " not null") + "}";
    }
}
