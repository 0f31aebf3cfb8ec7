package de.caluga.golden;

import de.caluga.golden.description.ClassDescription;
import de.caluga.golden.description.ReflectiveClassDescription;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Describes how a relation attribute is mapped: the related class, whether it holds one object or many,
 * and the relations of the related class to map as well.
 * <p>
 * The nested map is copied when the relation is created, so a relation can never contain itself.
 */
public final class NestedRelation {

    private final ClassDescription<?> description;
    private final boolean many;
    private final Map<String, NestedRelation> nestedMap;

    public NestedRelation(ClassDescription<?> description, boolean many) {
        this(description, many, null);
    }

    public NestedRelation(ClassDescription<?> description, boolean many, Map<String, NestedRelation> nestedMap) {
        if (description == null) {
            throw new IllegalArgumentException("description of related class must not be null");
        }

        this.description = description;
        this.many = many;
        this.nestedMap = nestedMap == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(nestedMap));
    }

    public static NestedRelation one(Class<?> related) {
        return new NestedRelation(ReflectiveClassDescription.of(related), false);
    }

    public static NestedRelation many(Class<?> related) {
        return new NestedRelation(ReflectiveClassDescription.of(related), true);
    }

    /**
     * @return copy of this relation with one more nested relation
     */
    public NestedRelation with(String attribute, NestedRelation relation) {
        Map<String, NestedRelation> m = new LinkedHashMap<>(nestedMap);
        m.put(attribute, relation);
        return new NestedRelation(description, many, m);
    }

    public ClassDescription<?> getDescription() {
        return description;
    }

    public boolean isMany() {
        return many;
    }

    public Map<String, NestedRelation> getNestedMap() {
        return nestedMap;
    }

    @Override
    public String toString() {
        return "NestedRelation{" + description.getName() + (many ? "[]" : "") + (nestedMap.isEmpty() ? "" : ", nested=" + nestedMap.keySet()) + "}";
    }
}
