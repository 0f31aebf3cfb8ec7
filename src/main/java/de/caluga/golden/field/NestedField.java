package de.caluga.golden.field;

import de.caluga.golden.CaseChangingMapper;
import de.caluga.golden.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Related object (or list of related objects) converted by its own mapper. Errors of the nested data are
 * reported with keys relative to this field, list entries prefixed with their index.
 */
@SuppressWarnings("unchecked")
public class NestedField extends MappedField {

    private final CaseChangingMapper mapper;
    private final boolean many;

    public NestedField(CaseChangingMapper mapper, boolean many) {
        this(mapper, many, null, false, true, false, false);
    }

    private NestedField(CaseChangingMapper mapper, boolean many, String attribute, boolean required, boolean allowNull, boolean dumpOnly, boolean loadOnly) {
        super(attribute, required, allowNull, dumpOnly, loadOnly);

        if (mapper == null) {
            throw new IllegalArgumentException("nested mapper must not be null");
        }

        this.mapper = mapper;
        this.many = many;
    }

    public CaseChangingMapper getMapper() {
        return mapper;
    }

    public boolean isMany() {
        return many;
    }

    @Override
    protected MappedField copy(String attribute, boolean required, boolean allowNull, boolean dumpOnly, boolean loadOnly) {
        return new NestedField(mapper, many, attribute, required, allowNull, dumpOnly, loadOnly);
    }

    @Override
    public Object serialize(Object value) {
        if (!many) {
            return mapper.serialize(value);
        }

        if (!(value instanceof Iterable)) {
            throw new IllegalArgumentException("Expected a collection of related objects, got " + value.getClass().getName());
        }

        List<Object> ret = new ArrayList<>();

        for (Object o : (Iterable<?>) value) {
            ret.add(o == null ? null : mapper.serialize(o));
        }

        return ret;
    }

    @Override
    public Object deserialize(Object raw) {
        if (!many) {
            if (!(raw instanceof Map)) {
                throw new IllegalArgumentException("Invalid input type.");
            }

            return mapper.load((Map<String, Object>) raw);
        }

        if (!(raw instanceof Collection)) {
            throw new IllegalArgumentException("Invalid type.");
        }

        List<Object> ret = new ArrayList<>();
        Map<String, List<String>> errors = new LinkedHashMap<>();
        int idx = 0;

        for (Object o : (Collection<?>) raw) {
            if (!(o instanceof Map)) {
                errors.put(String.valueOf(idx), List.of("Invalid input type."));
            } else {
                try {
                    ret.add(mapper.load((Map<String, Object>) o));
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
}
