package de.caluga.golden;

import de.caluga.golden.codec.CodecRegistry;
import de.caluga.golden.config.MapperSettings;
import de.caluga.golden.description.AttributeDescriptor;
import de.caluga.golden.description.AttributeType;
import de.caluga.golden.description.ClassDescription;
import de.caluga.golden.description.ReflectiveClassDescription;
import de.caluga.golden.field.AttributeReader;
import de.caluga.golden.field.EnumField;
import de.caluga.golden.field.MappedField;
import de.caluga.golden.field.NestedField;
import de.caluga.golden.field.ValueField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mapper whose fields are generated from a {@link ClassDescription}.
 * <p>
 * Every attribute gets a field with the codec registered for its type. Relations listed in the nested map
 * get a {@link NestedField} holding a {@code GoldenMapper} of the related class, built with the same
 * settings. Manually declared fields always take precedence over generated ones of the same name.
 * Deserialization creates new instances of the described class.
 *
 * <pre>
 * Map&lt;String, NestedRelation&gt; nested = new LinkedHashMap&lt;&gt;();
 * nested.put("alchemists", NestedRelation.many(Alchemist.class).with("formulae", NestedRelation.many(Formula.class)));
 * GoldenMapper&lt;WizardCollege&gt; mapper = new GoldenMapper&lt;&gt;(ReflectiveClassDescription.of(WizardCollege.class), nested);
 * Map&lt;String, Object&gt; data = mapper.serialize(college);
 * </pre>
 *
 * @param <T> the mapped class
 */
public class GoldenMapper<T> extends CaseChangingMapper {

    private static final Logger log = LoggerFactory.getLogger(GoldenMapper.class);

    private final ClassDescription<T> description;
    private final boolean newObject;

    public GoldenMapper(ClassDescription<T> description) {
        this(description, null, new MapperSettings());
    }

    public GoldenMapper(ClassDescription<T> description, Map<String, NestedRelation> nestedMap) {
        this(description, nestedMap, new MapperSettings());
    }

    public GoldenMapper(ClassDescription<T> description, Map<String, NestedRelation> nestedMap, MapperSettings settings) {
        this(description, nestedMap, settings, null);
    }

    public GoldenMapper(ClassDescription<T> description, Map<String, NestedRelation> nestedMap, boolean snakeToCamel, boolean camelToSnake, boolean newObject) {
        this(description, nestedMap, new MapperSettings().setSnakeToCamel(snakeToCamel).setCamelToSnake(camelToSnake).setNewObject(newObject));
    }

    /**
     * @param description    the class to map
     * @param nestedMap      relation attribute to related class, may be null
     * @param settings       casing, new object mode and nesting limit
     * @param declaredFields manually declared fields, may be null. They are serialized first and are never
     *                       replaced by generated fields
     * @throws InvalidConfigurationException if the settings contradict each other, an attribute type has no
     *                                       codec or the relations nest too deep
     */
    public GoldenMapper(ClassDescription<T> description, Map<String, NestedRelation> nestedMap, MapperSettings settings, Map<String, MappedField> declaredFields) {
        this(description, nestedMap, settings, declaredFields, 1);
    }

    private GoldenMapper(ClassDescription<T> description, Map<String, NestedRelation> nestedMap, MapperSettings settings, Map<String, MappedField> declaredFields, int depth) {
        super(settings.getCasingPolicy(), generateFields(description, nestedMap, settings, declaredFields, depth), new DescriptionReader(description));
        this.description = description;
        this.newObject = settings.isNewObject();
    }

    public static <T> GoldenMapper<T> forClass(Class<T> cls) {
        return new GoldenMapper<>(ReflectiveClassDescription.of(cls));
    }

    public static <T> GoldenMapper<T> forClass(Class<T> cls, Map<String, NestedRelation> nestedMap, MapperSettings settings) {
        return new GoldenMapper<>(ReflectiveClassDescription.of(cls), nestedMap, settings);
    }

    private static Map<String, MappedField> generateFields(ClassDescription<?> description, Map<String, NestedRelation> nestedMap, MapperSettings settings, Map<String, MappedField> declaredFields, int depth) {
        if (description == null) {
            throw new IllegalArgumentException("class description must not be null");
        }

        CasingPolicy casing = settings.getCasingPolicy();

        if (depth > settings.getMaxNestingDepth()) {
            throw new InvalidConfigurationException("Relations nested deeper than " + settings.getMaxNestingDepth() + " levels at " + description.getName());
        }

        Map<String, MappedField> declared = declaredFields == null ? new LinkedHashMap<>() : declaredFields;
        Map<String, NestedRelation> nested = nestedMap == null ? new LinkedHashMap<>() : nestedMap;
        Map<String, MappedField> generated = new LinkedHashMap<>();

        for (AttributeDescriptor a : description.getAttributes()) {
            if (nested.containsKey(a.getName()) || declared.containsKey(a.getName())) {
                //mapped by relation or declared manually
                continue;
            }

            generated.put(a.getName(), fieldFor(a, casing));
        }

        for (Map.Entry<String, NestedRelation> e : nested.entrySet()) {
            if (declared.containsKey(e.getKey())) {
                continue;
            }

            NestedRelation rel = e.getValue();

            if (log.isDebugEnabled()) {
                log.debug("Creating nested mapper for " + description.getName() + "." + e.getKey() + " -> " + rel);
            }

            GoldenMapper<?> sub = new GoldenMapper<>(rel.getDescription(), rel.getNestedMap(), settings, null, depth + 1);
            generated.put(e.getKey(), new NestedField(sub, rel.isMany()));
        }

        return addFields(description, declared, generated, settings.isNewObject());
    }

    /**
     * the field for one attribute, see {@link CodecRegistry}
     */
    private static MappedField fieldFor(AttributeDescriptor a, CasingPolicy casing) {
        MappedField f;

        if (a.getType() == AttributeType.NESTED_REFERENCE) {
            throw new UnsupportedTypeException(a.getName(), a.getType(), "relations need an entry in the nested map");
        } else if (a.getType() == AttributeType.ENUM) {
            f = new EnumField(CodecRegistry.enumCodec(a), casing);
        } else {
            f = new ValueField<>(CodecRegistry.codecFor(a));
        }

        return f.nullable(a.isNullable());
    }

    private static Map<String, MappedField> addFields(ClassDescription<?> description, Map<String, MappedField> declared, Map<String, MappedField> generated, boolean newObject) {
        Map<String, MappedField> ret = new LinkedHashMap<>(declared);

        for (Map.Entry<String, MappedField> e : generated.entrySet()) {
            String name = e.getKey();

            if (ret.containsKey(name)) {
                log.debug("Field {} of {} is declared manually - not generating it", name, description.getName());
                continue;
            }

            if (newObject && name.equals(description.getIdentityAttribute())) {
                log.debug("Leaving out identity field {} of {} for new objects", name, description.getName());
                continue;
            }

            ret.put(name, e.getValue());
        }

        return ret;
    }

    public ClassDescription<T> getDescription() {
        return description;
    }

    public boolean isNewObject() {
        return newObject;
    }

    /**
     * deserializes data into a new instance of the described class
     *
     * @throws ValidationException           if the data does not fit the fields
     * @throws InvalidConfigurationException if the class does not accept the deserialized attributes
     */
    public T deserialize(Map<String, Object> data) {
        return description.newInstance(deserializeAttributes(data));
    }

    /**
     * deserializes a list of objects. Errors are collected over all entries, keys prefixed with the index.
     */
    @SuppressWarnings("unchecked")
    public List<T> deserializeList(Collection<?> data) {
        List<T> ret = new ArrayList<>();
        Map<String, List<String>> errors = new LinkedHashMap<>();
        int idx = 0;

        for (Object o : data) {
            if (!(o instanceof Map)) {
                errors.put(String.valueOf(idx), List.of("Invalid input type."));
            } else {
                try {
                    ret.add(deserialize((Map<String, Object>) o));
                } catch (ValidationException e) {
                    for (Map.Entry<String, List<String>> err : e.getMessages().entrySet()) {
                        errors.put(idx + "." + err.getKey(), err.getValue());
                    }
                }
            }

            idx++;
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        return ret;
    }

    public T fromJson(String json) {
        return deserialize(parseJson(json));
    }

    @Override
    public T load(Map<String, Object> data) {
        return deserialize(data);
    }

    /**
     * reads attributes through the class description
     */
    private static class DescriptionReader implements AttributeReader {
        private final ClassDescription<?> description;
        private final ReflectionHelper reflection = new ReflectionHelper();

        DescriptionReader(ClassDescription<?> description) {
            this.description = description;
        }

        @Override
        public Object read(Object source, String attribute) {
            if (source instanceof Map) {
                return reflection.getValue(source, attribute);
            }

            return description.getValue(source, attribute);
        }

        @Override
        public boolean hasAttribute(Object source, String attribute) {
            return description.getAttribute(attribute) != null || reflection.hasAttribute(source, attribute);
        }
    }
}
