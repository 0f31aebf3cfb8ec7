package de.caluga.golden;

import de.caluga.golden.field.AttributeReader;
import org.apache.commons.lang3.ClassUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Encapsulates all calls to the reflection API. The structure of classes does not change at runtime, so
 * field lists and accessors are cached.
 * <p>
 * Objects implementing {@link Map} are treated as stand-ins: their keys are their attributes.
 * <p>
 * this class is ThreadSafe!
 */
@SuppressWarnings("unchecked")
public class ReflectionHelper implements AttributeReader {

    private static final Map<Class<?>, List<Field>> fieldListCache = new ConcurrentHashMap<>();
    private static final Map<String, Optional<Field>> fieldCache = new ConcurrentHashMap<>();
    private static final Map<String, Optional<Method>> getterCache = new ConcurrentHashMap<>();

    private final Logger log = LoggerFactory.getLogger(ReflectionHelper.class);

    /**
     * return list of instance fields in class - including hierarchy, superclass fields first
     *
     * @param clz class to get all fields for
     * @return list of fields in that class, static and synthetic fields are left out
     */
    public List<Field> getAllFields(Class<?> clz) {
        if (clz == null || Map.class.isAssignableFrom(clz)) {
            return Collections.emptyList();
        }

        return fieldListCache.computeIfAbsent(clz, cls -> {
            List<Class<?>> hierarchy = new ArrayList<>();
            Class<?> sc = cls;

            while (sc != null && !sc.equals(Object.class)) {
                hierarchy.add(0, sc);
                sc = sc.getSuperclass();
            }

            List<Field> ret = new ArrayList<>();

            for (Class<?> c : hierarchy) {
                for (Field f : c.getDeclaredFields()) {
                    if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic() || f.getName().startsWith("$jacoco")) {
                        continue;
                    }

                    ret.add(f);
                }
            }

            return Collections.unmodifiableList(ret);
        });
    }

    /**
     * @return the field with that name, searching the hierarchy. Subclass fields shadow inherited ones. null, if not found
     */
    public Field getField(Class<?> clz, String fld) {
        if (clz == null || Map.class.isAssignableFrom(clz)) {
            return null;
        }

        return fieldCache.computeIfAbsent(clz.getName() + "->" + fld, k -> {
            List<Field> flds = getAllFields(clz);

            for (int i = flds.size() - 1; i >= 0; i--) {
                Field f = flds.get(i);

                if (f.getName().equals(fld)) {
                    f.setAccessible(true);
                    return Optional.of(f);
                }
            }

            return Optional.empty();
        }).orElse(null);
    }

    private Method getGetter(Class<?> clz, String fld) {
        return getterCache.computeIfAbsent(clz.getName() + "->" + fld, k -> {
            String suffix = fld.substring(0, 1).toUpperCase(Locale.ROOT) + fld.substring(1);
            List<String> candidates = List.of("get" + suffix, "is" + suffix, fld);
            Method found = null;

            for (Method m : clz.getMethods()) {
                if (m.getParameterCount() != 0 || Modifier.isStatic(m.getModifiers()) || m.getReturnType() == void.class) {
                    continue;
                }

                int idx = candidates.indexOf(m.getName());

                if (idx >= 0 && (found == null || idx < candidates.indexOf(found.getName()))) {
                    found = m;
                }
            }

            return Optional.ofNullable(found);
        }).orElse(null);
    }

    @Override
    public boolean hasAttribute(Object o, String fld) {
        if (o == null) {
            return false;
        }

        if (o instanceof Map) {
            return ((Map<String, Object>) o).containsKey(fld);
        }

        return getField(o.getClass(), fld) != null || getGetter(o.getClass(), fld) != null;
    }

    @Override
    public Object read(Object source, String attribute) {
        return getValue(source, attribute);
    }

    /**
     * reads the value of a field - or the matching getter, if there is no such field
     *
     * @throws InvalidConfigurationException if the object has no such attribute or it cannot be read
     */
    public Object getValue(Object o, String fld) {
        if (o == null) {
            return null;
        }

        if (o instanceof Map) {
            Map<String, Object> m = (Map<String, Object>) o;

            if (!m.containsKey(fld)) {
                throw new InvalidConfigurationException("Map stand-in has no attribute '" + fld + "'");
            }

            return m.get(fld);
        }

        try {
            Field f = getField(o.getClass(), fld);

            if (f != null) {
                return f.get(o);
            }

            Method getter = getGetter(o.getClass(), fld);

            if (getter != null) {
                return getter.invoke(o);
            }
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new InvalidConfigurationException("Could not read attribute '" + fld + "' of " + o.getClass().getName(), e);
        }

        throw new InvalidConfigurationException("Object of type " + o.getClass().getName() + " has no attribute '" + fld + "'");
    }

    /**
     * sets the value of a field, converting numbers and collections to the field type where necessary
     *
     * @throws InvalidConfigurationException if there is no such field or the value does not fit
     */
    public void setValue(Object o, String fld, Object value) {
        Field field = getField(o.getClass(), fld);

        if (field == null) {
            throw new InvalidConfigurationException(o.getClass().getSimpleName() + " got an unexpected attribute '" + fld + "'");
        }

        try {
            if (value == null && field.getType().isPrimitive()) {
                throw new InvalidConfigurationException("Cannot set primitive field '" + fld + "' of " + o.getClass().getSimpleName() + " to null");
            }

            if (value == null || ClassUtils.isAssignable(value.getClass(), field.getType(), true)) {
                field.set(o, value);
                return;
            }

            if (log.isDebugEnabled()) {
                log.debug("Setting of value (" + value.getClass().getSimpleName() + ") for field " + field.getName() + " needs type-conversion");
            }

            field.set(o, convertType(value, fld, field.getType()));
        } catch (IllegalAccessException | IllegalArgumentException e) {
            throw new InvalidConfigurationException("Could not set attribute '" + fld + "' of " + o.getClass().getSimpleName(), e);
        }
    }

    /**
     * creates a new instance through the no-argument constructor
     */
    public <T> T newInstance(Class<T> cls) {
        try {
            Constructor<T> c = cls.getDeclaredConstructor();
            c.setAccessible(true);
            return c.newInstance();
        } catch (NoSuchMethodException e) {
            throw new InvalidConfigurationException(cls.getName() + " needs a no-argument constructor", e);
        } catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new InvalidConfigurationException("Could not instantiate " + cls.getName(), e);
        }
    }

    public static Object convertType(Object value, String fieldName, Class<?> fieldType) {
        Class<?> type = ClassUtils.primitiveToWrapper(fieldType);

        if (value instanceof Number) {
            Number n = (Number) value;

            if (type.equals(Double.class)) {
                return n.doubleValue();
            } else if (type.equals(Float.class)) {
                return n.floatValue();
            }

            try {
                BigDecimal exact = new BigDecimal(n.toString());

                if (type.equals(Integer.class)) {
                    return exact.intValueExact();
                } else if (type.equals(Long.class)) {
                    return exact.longValueExact();
                } else if (type.equals(Short.class)) {
                    return exact.shortValueExact();
                } else if (type.equals(Byte.class)) {
                    return exact.byteValueExact();
                }
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IllegalArgumentException("value " + n + " does not fit into " + fieldType.getSimpleName() + " field " + fieldName, e);
            }
        } else if (value instanceof Collection) {
            if (Set.class.isAssignableFrom(type)) {
                return new LinkedHashSet<>((Collection<Object>) value);
            } else if (type.isAssignableFrom(ArrayList.class)) {
                return new ArrayList<>((Collection<Object>) value);
            }
        }

        throw new IllegalArgumentException("cannot convert " + value.getClass().getSimpleName() + " to " + fieldType.getSimpleName() + " for field " + fieldName);
    }
}
