package de.caluga.golden.description;

import de.caluga.golden.InvalidConfigurationException;
import de.caluga.golden.ReflectionHelper;
import de.caluga.golden.annotations.Column;
import de.caluga.golden.annotations.Id;
import de.caluga.golden.annotations.Relation;
import de.caluga.golden.annotations.Transient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Describes a class by its fields.
 * <p>
 * Every non static field is an attribute, unless it is marked {@link Transient} or {@link Relation}. The
 * attribute type is derived from the field type or taken from {@link Column}. Instances are created with
 * the no-argument constructor, then every value is assigned to its field.
 *
 * @param <T> described class
 */
public class ReflectiveClassDescription<T> implements ClassDescription<T> {

    private static final Map<Class<?>, ReflectiveClassDescription<?>> cache = new ConcurrentHashMap<>();

    private final Logger log = LoggerFactory.getLogger(ReflectiveClassDescription.class);
    private final ReflectionHelper reflection = new ReflectionHelper();
    private final Class<T> type;
    private final List<AttributeDescriptor> attributes;
    private final Set<String> relations;
    private final String identityAttribute;

    private ReflectiveClassDescription(Class<T> type) {
        this.type = type;
        List<AttributeDescriptor> attrs = new ArrayList<>();
        Set<String> rel = new LinkedHashSet<>();
        String id = DEFAULT_IDENTITY_ATTRIBUTE;

        for (Field f : reflection.getAllFields(type)) {
            if (f.isAnnotationPresent(Transient.class)) {
                continue;
            }

            if (f.isAnnotationPresent(Relation.class)) {
                rel.add(f.getName());
                continue;
            }

            if (f.isAnnotationPresent(Id.class)) {
                id = f.getName();
            }

            attrs.add(describe(f));
        }

        this.attributes = Collections.unmodifiableList(attrs);
        this.relations = Collections.unmodifiableSet(rel);
        this.identityAttribute = id;
        log.debug("Described {}: {} attributes, relations {}", type.getName(), attrs.size(), rel);
    }

    @SuppressWarnings("unchecked")
    public static <T> ReflectiveClassDescription<T> of(Class<T> type) {
        if (type.isInterface() || type.isPrimitive() || type.isArray() || Map.class.isAssignableFrom(type)) {
            throw new InvalidConfigurationException("Cannot describe " + type.getName() + " - not a plain class");
        }

        return (ReflectiveClassDescription<T>) cache.computeIfAbsent(type, ReflectiveClassDescription::new);
    }

    private AttributeDescriptor describe(Field f) {
        Column col = f.getAnnotation(Column.class);
        boolean nullable = !f.getType().isPrimitive() && !f.isAnnotationPresent(Id.class) && (col == null || col.nullable());
        AttributeType declared = col == null ? AttributeType.AUTO : col.type();
        AttributeType attributeType = declared == AttributeType.AUTO ? typeOf(f.getType()) : declared;

        if (attributeType == AttributeType.ARRAY) {
            Class<?> elementClass = elementClassOf(f);
            AttributeType elementType = col == null ? AttributeType.AUTO : col.elementType();

            if (elementType == AttributeType.AUTO && elementClass != null) {
                elementType = typeOf(elementClass);
            }

            return AttributeDescriptor.arrayOf(f.getName(), elementType, elementClass, nullable);
        }

        return AttributeDescriptor.of(f.getName(), attributeType, f.getType(), nullable);
    }

    /**
     * maps a java type to the attribute type used for it - {@link AttributeType#AUTO} if there is none
     */
    public static AttributeType typeOf(Class<?> cls) {
        if (cls.equals(String.class)) {
            return AttributeType.STRING;
        } else if (cls.equals(Integer.class) || cls.equals(int.class) || cls.equals(Short.class) || cls.equals(short.class)) {
            return AttributeType.INTEGER;
        } else if (cls.equals(Long.class) || cls.equals(long.class)) {
            return AttributeType.LONG;
        } else if (cls.equals(Boolean.class) || cls.equals(boolean.class)) {
            return AttributeType.BOOLEAN;
        } else if (cls.equals(LocalDate.class)) {
            return AttributeType.DATE;
        } else if (cls.equals(LocalDateTime.class) || cls.equals(Instant.class) || cls.equals(OffsetDateTime.class) || cls.equals(ZonedDateTime.class) || Date.class.isAssignableFrom(cls)) {
            return AttributeType.TIMESTAMP;
        } else if (cls.equals(UUID.class)) {
            return AttributeType.UUID;
        } else if (cls.isEnum()) {
            return AttributeType.ENUM;
        } else if (Collection.class.isAssignableFrom(cls)) {
            return AttributeType.ARRAY;
        } else if (cls.isArray() || cls.isPrimitive()) {
            //no codec for java arrays or the remaining primitives
            return AttributeType.AUTO;
        } else if (Map.class.isAssignableFrom(cls)) {
            return AttributeType.RAW;
        }

        return AttributeType.NESTED_REFERENCE;
    }

    private static Class<?> elementClassOf(Field f) {
        Type generic = f.getGenericType();

        if (generic instanceof ParameterizedType) {
            Type[] args = ((ParameterizedType) generic).getActualTypeArguments();

            if (args.length == 1 && args[0] instanceof Class) {
                return (Class<?>) args[0];
            }
        }

        return null;
    }

    @Override
    public Class<T> getType() {
        return type;
    }

    @Override
    public List<AttributeDescriptor> getAttributes() {
        return attributes;
    }

    /**
     * @return names of the fields marked as {@link Relation}
     */
    public Set<String> getRelations() {
        return relations;
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
        T ret = reflection.newInstance(type);

        for (Map.Entry<String, Object> e : values.entrySet()) {
            if (getAttribute(e.getKey()) == null && !relations.contains(e.getKey())) {
                throw new InvalidConfigurationException(type.getSimpleName() + " got an unexpected attribute '" + e.getKey() + "'");
            }

            reflection.setValue(ret, e.getKey(), e.getValue());
        }

        return ret;
    }

    @Override
    public String toString() {
        return "ReflectiveClassDescription{" + type.getName() + "}";
    }
}
