package de.caluga.test.golden;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import de.caluga.golden.InvalidConfigurationException;
import de.caluga.golden.ReflectionHelper;
import de.caluga.golden.codec.BooleanCodec;

@Tag("util")
public class ReflectionHelperTest {
    private final ReflectionHelper helper = new ReflectionHelper();

    public static class Parent {
        protected String name = "parent";
        private int counter;
    }

    public static class Child extends Parent {
        private static int instances;
        protected String name = "child";
        private Set<String> tags;
        private long total;

        public boolean isActive() {
            return true;
        }

        public String getLabel() {
            return "label";
        }
    }

    public static class Gauge {
        private short level;
        private Byte flags;
    }

    public static class Token {
        private final String ident = "t-1";

        public String getId() {
            return ident;
        }
    }

    @Test
    public void allFields() {
        List<String> names = new ArrayList<>();

        for (Field f : helper.getAllFields(Child.class)) {
            names.add(f.getName());
        }

        assertThat(names).containsExactly("name", "counter", "name", "tags", "total");
        assertThat(helper.getAllFields(HashMap.class)).isEmpty();
    }

    @Test
    public void shadowedFields() {
        Child c = new Child();
        assertEquals(Child.class, helper.getField(Child.class, "name").getDeclaringClass());
        assertEquals("child", helper.getValue(c, "name"));
        assertNull(helper.getField(Child.class, "missing"));
    }

    @Test
    public void gettersAsAttributes() {
        Child c = new Child();
        assertEquals(Boolean.TRUE, helper.getValue(c, "active"));
        assertEquals("label", helper.getValue(c, "label"));
        assertTrue(helper.hasAttribute(c, "label"));
        assertFalse(helper.hasAttribute(c, "missing"));
        assertThatThrownBy(() -> helper.getValue(c, "missing"))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("has no attribute 'missing'");
    }

    @Test
    public void mapStandIns() {
        Map<String, Object> m = new HashMap<>();
        m.put("a", null);
        assertTrue(helper.hasAttribute(m, "a"));
        assertNull(helper.getValue(m, "a"));
        assertFalse(helper.hasAttribute(m, "b"));
        assertThatThrownBy(() -> helper.getValue(m, "b")).isInstanceOf(InvalidConfigurationException.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    public void setValueConvertsTypes() {
        Child c = new Child();
        helper.setValue(c, "total", 5);
        assertEquals(5L, helper.getValue(c, "total"));
        helper.setValue(c, "tags", List.of("a", "b", "a"));
        assertThat((Set<Object>) helper.getValue(c, "tags")).containsExactly("a", "b");
        helper.setValue(c, "counter", 2);
        assertEquals(2, helper.getValue(c, "counter"));

        assertThatThrownBy(() -> helper.setValue(c, "total", null)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> helper.setValue(c, "total", "many")).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> helper.setValue(c, "unknown", 1))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("unexpected attribute 'unknown'");
    }

    @Test
    public void convertType() {
        assertEquals(3, ReflectionHelper.convertType(3L, "f", int.class));
        assertEquals(3.0, ReflectionHelper.convertType(3, "f", Double.class));
        assertThat(ReflectionHelper.convertType(Set.of(1), "f", List.class)).isInstanceOf(ArrayList.class);
        assertThatThrownBy(() -> ReflectionHelper.convertType("x", "f", Integer.class)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void narrowingNeverWraps() {
        Gauge g = new Gauge();
        helper.setValue(g, "level", 1234);
        assertEquals((short) 1234, helper.getValue(g, "level"));
        helper.setValue(g, "flags", 7L);
        assertEquals((byte) 7, helper.getValue(g, "flags"));

        assertThatThrownBy(() -> helper.setValue(g, "level", 40000)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> helper.setValue(g, "flags", 300)).isInstanceOf(InvalidConfigurationException.class);
        assertEquals((short) 1234, helper.getValue(g, "level"));

        assertThatThrownBy(() -> ReflectionHelper.convertType(40000, "level", short.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReflectionHelper.convertType(5_000_000_000L, "count", Integer.class)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ReflectionHelper.convertType(2.5, "count", Long.class)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void getterLookupIgnoresDefaultLocale() {
        Locale before = Locale.getDefault();

        try {
            Locale.setDefault(new Locale("tr", "TR"));
            assertEquals("t-1", helper.getValue(new Token(), "id"));
            assertEquals(Boolean.TRUE, new BooleanCodec().unmarshall("TRUE"));
        } finally {
            Locale.setDefault(before);
        }
    }
}
