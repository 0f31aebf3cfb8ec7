package de.caluga.golden.config;

import de.caluga.golden.CaseConverter;
import de.caluga.golden.InvalidConfigurationException;
import de.caluga.golden.ReflectionHelper;
import de.caluga.golden.annotations.Transient;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * Base of all settings classes: copying, comparison and conversion from and to {@link Properties}.
 * <p>
 * Property keys are the field names, optionally with a prefix. Snake case keys are accepted as well, so
 * {@code maxNestingDepth} can also be given as {@code max_nesting_depth}.
 */
public abstract class Settings {

    private static final ReflectionHelper reflection = new ReflectionHelper();

    public Properties asProperties() {
        return asProperties(null);
    }

    /**
     * @param prefix prefix to use in property keys
     * @return all values that differ from the defaults
     */
    public Properties asProperties(String prefix) {
        Properties p = new Properties();
        prefix = prefix == null || prefix.isEmpty() ? "" : prefix + ".";
        Settings defaults = reflection.newInstance(getClass());

        try {
            for (Field f : settingFields()) {
                Object v = f.get(this);

                if (v != null && !v.equals(f.get(defaults))) {
                    p.put(prefix + f.getName(), v.toString());
                }
            }
        } catch (IllegalAccessException e) {
            throw new InvalidConfigurationException("Could not read settings " + getClass().getSimpleName(), e);
        }

        return p;
    }

    /**
     * sets all fields found in the properties, keeping the defaults for the others
     *
     * @throws InvalidConfigurationException if a value cannot be parsed
     */
    protected void applyProperties(String prefix, Properties p) {
        prefix = prefix == null || prefix.isEmpty() ? "" : prefix + ".";

        for (Field f : settingFields()) {
            String value = p.getProperty(prefix + f.getName());

            if (value == null) {
                value = findSnakeCaseValue(prefix, f.getName(), p);
            }

            if (value == null) {
                continue;
            }

            reflection.setValue(this, f.getName(), parse(f, value.trim()));
        }
    }

    /**
     * snake_case keys are matched by converting them to camel case, the other direction is lossy
     */
    private static String findSnakeCaseValue(String prefix, String fieldName, Properties p) {
        for (String key : p.stringPropertyNames()) {
            if (!key.startsWith(prefix)) {
                continue;
            }

            String name = key.substring(prefix.length());

            if (name.indexOf('_') >= 0 && CaseConverter.toCamel(name).equals(fieldName)) {
                return p.getProperty(key);
            }
        }

        return null;
    }

    private static Object parse(Field f, String value) {
        Class<?> type = f.getType();

        if (type.equals(boolean.class) || type.equals(Boolean.class)) {
            if (!value.equalsIgnoreCase("true") && !value.equalsIgnoreCase("false")) {
                throw new InvalidConfigurationException("Setting " + f.getName() + " needs true or false, got '" + value + "'");
            }

            return Boolean.parseBoolean(value);
        } else if (type.equals(int.class) || type.equals(Integer.class)) {
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new InvalidConfigurationException("Setting " + f.getName() + " needs a number, got '" + value + "'", e);
            }
        } else if (type.equals(String.class)) {
            return value;
        }

        throw new InvalidConfigurationException("Setting " + f.getName() + " of type " + type.getSimpleName() + " cannot be read from properties");
    }

    private List<Field> settingFields() {
        List<Field> ret = new ArrayList<>();

        for (Field f : reflection.getAllFields(getClass())) {
            if (!f.isAnnotationPresent(Transient.class)) {
                f.setAccessible(true);
                ret.add(f);
            }
        }

        return ret;
    }

    @SuppressWarnings("unchecked")
    public <T extends Settings> T copy() {
        T ret = (T) reflection.newInstance(getClass());

        try {
            for (Field f : settingFields()) {
                f.set(ret, f.get(this));
            }
        } catch (IllegalAccessException e) {
            throw new InvalidConfigurationException("Failed to copy settings for " + getClass().getName(), e);
        }

        return ret;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (other == null || getClass() != other.getClass()) return false;

        try {
            for (Field f : settingFields()) {
                if (!Objects.equals(f.get(this), f.get(other))) {
                    return false;
                }
            }
        } catch (IllegalAccessException e) {
            throw new InvalidConfigurationException("Could not compare settings " + getClass().getSimpleName(), e);
        }

        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;

        try {
            for (Field f : settingFields()) {
                result = 31 * result + Objects.hashCode(f.get(this));
            }
        } catch (IllegalAccessException e) {
            throw new InvalidConfigurationException("Could not hash settings " + getClass().getSimpleName(), e);
        }

        return result;
    }
}
