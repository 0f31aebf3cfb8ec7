package de.caluga.golden;

/**
 * Direction of the name conversion applied to all fields of one mapper.
 */
public enum CasingPolicy {
    NONE,
    /**
     * internal snake_case names are exposed as camelCase
     */
    SNAKE_TO_CAMEL,
    /**
     * internal camelCase names are exposed as snake_case
     */
    CAMEL_TO_SNAKE;

    public static CasingPolicy of(boolean snakeToCamel, boolean camelToSnake) {
        if (snakeToCamel && camelToSnake) {
            throw new InvalidConfigurationException("Only one of snake_to_camel or camel_to_snake can be True");
        }

        if (snakeToCamel) {
            return SNAKE_TO_CAMEL;
        }

        return camelToSnake ? CAMEL_TO_SNAKE : NONE;
    }

    /**
     * @param name internal (declared) field name
     * @return the name used in serialized data
     */
    public String toExternal(String name) {
        switch (this) {
            case SNAKE_TO_CAMEL:
                return CaseConverter.toCamel(name);

            case CAMEL_TO_SNAKE:
                return CaseConverter.toSnake(name);

            default:
                return name;
        }
    }

    /**
     * reverses {@link #toExternal(String)} - as far as the conversion heuristic allows
     */
    public String toInternal(String externalName) {
        switch (this) {
            case SNAKE_TO_CAMEL:
                return CaseConverter.toSnake(externalName);

            case CAMEL_TO_SNAKE:
                return CaseConverter.toCamel(externalName);

            default:
                return externalName;
        }
    }
}
