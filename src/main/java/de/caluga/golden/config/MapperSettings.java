package de.caluga.golden.config;

import de.caluga.golden.CasingPolicy;
import de.caluga.golden.InvalidConfigurationException;

import java.util.Properties;

/**
 * Settings of a mapper, passed on unchanged to all nested mappers.
 */
public class MapperSettings extends Settings {

    public static final int DEFAULT_MAX_NESTING_DEPTH = 16;

    private boolean snakeToCamel = false;
    private boolean camelToSnake = false;
    private boolean newObject = false;
    private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;

    public static MapperSettings fromProperties(Properties p) {
        return fromProperties(null, p);
    }

    public static MapperSettings fromProperties(String prefix, Properties p) {
        MapperSettings ret = new MapperSettings();
        ret.applyProperties(prefix, p);

        if (ret.maxNestingDepth < 1) {
            throw new InvalidConfigurationException("maxNestingDepth must be at least 1, got " + ret.maxNestingDepth);
        }

        return ret;
    }

    /**
     * @throws InvalidConfigurationException if both casing directions are enabled
     */
    public CasingPolicy getCasingPolicy() {
        return CasingPolicy.of(snakeToCamel, camelToSnake);
    }

    public boolean isSnakeToCamel() {
        return snakeToCamel;
    }

    public MapperSettings setSnakeToCamel(boolean snakeToCamel) {
        this.snakeToCamel = snakeToCamel;
        return this;
    }

    public MapperSettings enableSnakeToCamel() {
        snakeToCamel = true;
        return this;
    }

    public boolean isCamelToSnake() {
        return camelToSnake;
    }

    public MapperSettings setCamelToSnake(boolean camelToSnake) {
        this.camelToSnake = camelToSnake;
        return this;
    }

    public MapperSettings enableCamelToSnake() {
        camelToSnake = true;
        return this;
    }

    /**
     * if set, mappers leave out the identity attribute, so deserialization creates objects without id
     */
    public boolean isNewObject() {
        return newObject;
    }

    public MapperSettings setNewObject(boolean newObject) {
        this.newObject = newObject;
        return this;
    }

    public MapperSettings enableNewObject() {
        newObject = true;
        return this;
    }

    public int getMaxNestingDepth() {
        return maxNestingDepth;
    }

    public MapperSettings setMaxNestingDepth(int maxNestingDepth) {
        if (maxNestingDepth < 1) {
            throw new InvalidConfigurationException("maxNestingDepth must be at least 1, got " + maxNestingDepth);
        }

        this.maxNestingDepth = maxNestingDepth;
        return this;
    }

    @Override
    public String toString() {
        return "MapperSettings{snakeToCamel=" + snakeToCamel + ", camelToSnake=" + camelToSnake + ", newObject=" + newObject + ", maxNestingDepth=" + maxNestingDepth + "}";
    }
}
