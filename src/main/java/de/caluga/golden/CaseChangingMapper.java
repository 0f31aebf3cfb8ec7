package de.caluga.golden;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.caluga.golden.config.MapperSettings;
import de.caluga.golden.field.AttributeReader;
import de.caluga.golden.field.MappedField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps objects to maps and back along a set of declared fields, exposing every field under a case
 * converted name:
 * <ul>
 * <li>{@link CasingPolicy#SNAKE_TO_CAMEL}: the field {@code attr_one} is serialized as {@code attrOne}</li>
 * <li>{@link CasingPolicy#CAMEL_TO_SNAKE}: the field {@code attrOne} is serialized as {@code attr_one}</li>
 * </ul>
 * Attribute values are always read from (and deserialized into) the declared field name, or the attribute a
 * field is bound to.
 * <p>
 * Deserialization is strict: all errors of the data are collected and thrown as one {@link ValidationException}.
 * <p>
 * Instances are immutable and can be shared between threads.
 */
public class CaseChangingMapper {

    private static final ObjectMapper jackson = new ObjectMapper();

    private final Logger log = LoggerFactory.getLogger(CaseChangingMapper.class);
    private final CasingPolicy casing;
    private final Map<String, MappedField> fields;
    private final Map<String, String> externalNames;
    private final AttributeReader reader;

    public CaseChangingMapper(Map<String, MappedField> declaredFields) {
        this(declaredFields, false, false);
    }

    /**
     * @param declaredFields field name to field, in the order they should be serialized
     * @throws InvalidConfigurationException if both directions are set
     */
    public CaseChangingMapper(Map<String, MappedField> declaredFields, boolean snakeToCamel, boolean camelToSnake) {
        this(CasingPolicy.of(snakeToCamel, camelToSnake), declaredFields, new ReflectionHelper());
    }

    public CaseChangingMapper(Map<String, MappedField> declaredFields, MapperSettings settings) {
        this(settings.getCasingPolicy(), declaredFields, new ReflectionHelper());
    }

    protected CaseChangingMapper(CasingPolicy casing, Map<String, MappedField> declaredFields, AttributeReader reader) {
        this.casing = casing;
        this.reader = reader;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(declaredFields));
        this.externalNames = Collections.unmodifiableMap(alterCase(casing, this.fields));
    }

    /**
     * computes the external name of every field
     *
     * @throws InvalidConfigurationException if two fields end up with the same external name
     */
    private Map<String, String> alterCase(CasingPolicy casing, Map<String, MappedField> flds) {
        Map<String, String> ret = new LinkedHashMap<>();
        Map<String, String> usedBy = new LinkedHashMap<>();

        for (String name : flds.keySet()) {
            if (flds.get(name) == null) {
                throw new InvalidConfigurationException("Field '" + name + "' is null");
            }

            String ext = casing.toExternal(name);
            String other = usedBy.putIfAbsent(ext, name);

            if (other != null) {
                log.warn("Fields " + other + " and " + name + " are both serialized as " + ext);
                throw new InvalidConfigurationException("Fields '" + other + "' and '" + name + "' both map to '" + ext + "'");
            }

            ret.put(name, ext);
        }

        return ret;
    }

    public CasingPolicy getCasingPolicy() {
        return casing;
    }

    /**
     * @return field name to field, in serialization order
     */
    public Map<String, MappedField> getFields() {
        return fields;
    }

    public MappedField getField(String name) {
        return fields.get(name);
    }

    /**
     * @return the name a field is serialized under, null for unknown fields
     */
    public String getExternalName(String fieldName) {
        return externalNames.get(fieldName);
    }

    /**
     * serializes an object - or a map standing in for one - along the declared fields
     *
     * @return external field name to json compatible value, in field order. Empty for null.
     * @throws InvalidConfigurationException if the object lacks an attribute or holds a value of the wrong type
     */
    public Map<String, Object> serialize(Object o) {
        Map<String, Object> ret = new LinkedHashMap<>();

        if (o == null) {
            return ret;
        }

        for (Map.Entry<String, MappedField> e : fields.entrySet()) {
            MappedField f = e.getValue();

            if (f.isLoadOnly()) {
                continue;
            }

            String ext = externalNames.get(e.getKey());
            Object value = f.extract(o, reader, e.getKey(), ext);

            try {
                ret.put(ext, value == null ? null : f.serialize(value));
            } catch (ClassCastException | IllegalArgumentException ex) {
                throw new InvalidConfigurationException("Could not serialize field " + e.getKey() + " of " + o.getClass().getSimpleName() + ": " + ex.getMessage(), ex);
            }
        }

        return ret;
    }

    public List<Map<String, Object>> serializeList(Collection<?> objects) {
        List<Map<String, Object>> ret = new ArrayList<>();

        for (Object o : objects) {
            ret.add(serialize(o));
        }

        return ret;
    }

    public String toJson(Object o) {
        try {
            return jackson.writeValueAsString(serialize(o));
        } catch (JsonProcessingException e) {
            throw new InvalidConfigurationException("Serialized value of " + o.getClass().getSimpleName() + " is no valid json", e);
        }
    }

    /**
     * deserializes data into a map keyed by attribute names. Unknown keys are ignored.
     *
     * @throws ValidationException listing every field with missing, null or unconvertible data
     */
    public Map<String, Object> deserializeAttributes(Map<String, Object> data) {
        if (data == null) {
            throw new ValidationException(ValidationException.SCHEMA_KEY, "Invalid input type.");
        }

        Map<String, Object> ret = new LinkedHashMap<>();
        Map<String, List<String>> errors = new LinkedHashMap<>();

        for (Map.Entry<String, MappedField> e : fields.entrySet()) {
            MappedField f = e.getValue();

            if (f.isDumpOnly()) {
                continue;
            }

            String ext = externalNames.get(e.getKey());
            String attribute = f.attributeFor(e.getKey());

            if (!data.containsKey(ext)) {
                if (f.isRequired()) {
                    addError(errors, ext, "Missing data for required field.");
                }

                continue;
            }

            Object raw = data.get(ext);

            if (raw == null) {
                if (f.isAllowNull()) {
                    ret.put(attribute, null);
                } else {
                    addError(errors, ext, "Field may not be null.");
                }

                continue;
            }

            try {
                ret.put(attribute, f.deserialize(raw));
            } catch (ValidationException ve) {
                for (Map.Entry<String, List<String>> nested : ve.getMessages().entrySet()) {
                    for (String msg : nested.getValue()) {
                        addError(errors, ext + "." + nested.getKey(), msg);
                    }
                }
            } catch (IllegalArgumentException ex) {
                addError(errors, ext, ex.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            if (log.isDebugEnabled()) {
                log.debug("Deserialization failed for fields " + errors.keySet());
            }

            throw new ValidationException(errors);
        }

        return ret;
    }

    /**
     * deserializes one object. Subclasses return the reconstructed object, here it is the attribute map.
     */
    public Object load(Map<String, Object> data) {
        return deserializeAttributes(data);
    }

    /**
     * like {@link #deserializeAttributes(Map)}, for a json object
     */
    public Map<String, Object> deserializeJson(String json) {
        return deserializeAttributes(parseJson(json));
    }

    /**
     * @throws ValidationException if the string is no json object
     */
    protected static Map<String, Object> parseJson(String json) {
        try {
            Map<String, Object> ret = jackson.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {
            });

            if (ret == null) {
                throw new ValidationException(ValidationException.SCHEMA_KEY, "Invalid input type.");
            }

            return ret;
        } catch (JsonProcessingException e) {
            throw new ValidationException(ValidationException.SCHEMA_KEY, "Invalid json: " + e.getOriginalMessage());
        }
    }

    private static void addError(Map<String, List<String>> errors, String field, String msg) {
        errors.computeIfAbsent(field, k -> new ArrayList<>()).add(msg);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{casing=" + casing + ", fields=" + externalNames + "}";
    }
}
