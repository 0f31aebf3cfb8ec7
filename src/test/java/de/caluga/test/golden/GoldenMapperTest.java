package de.caluga.test.golden;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.caluga.golden.GoldenMapper;
import de.caluga.golden.InvalidConfigurationException;
import de.caluga.golden.NestedRelation;
import de.caluga.golden.UnsupportedTypeException;
import de.caluga.golden.ValidationException;
import de.caluga.golden.annotations.Column;
import de.caluga.golden.annotations.Id;
import de.caluga.golden.config.MapperSettings;
import de.caluga.golden.description.AttributeDescriptor;
import de.caluga.golden.description.AttributeType;
import de.caluga.golden.description.ReflectiveClassDescription;
import de.caluga.golden.description.SimpleClassDescription;
import de.caluga.golden.field.Fields;
import de.caluga.golden.field.MappedField;
import de.caluga.golden.field.MethodField;
import de.caluga.golden.field.NestedField;
import de.caluga.test.golden.data.Alchemist;
import de.caluga.test.golden.data.CamelFormula;
import de.caluga.test.golden.data.Cauldron;
import de.caluga.test.golden.data.Formula;
import de.caluga.test.golden.data.WizardCollege;

@Tag("mapper")
public class GoldenMapperTest {
    private Logger log = LoggerFactory.getLogger(GoldenMapperTest.class);

    public static class Tally {
        @Id
        public Integer id;
        @Column(type = AttributeType.INTEGER)
        public Long count;
    }

    public static class Gauge {
        @Id
        public Integer id;
        public Short level;
    }

    private WizardCollege school;
    private Alchemist alchemist;
    private Map<String, NestedRelation> nestedMap;

    @BeforeEach
    public void setup() {
        school = new WizardCollege(1, "Bogwarts");
        alchemist = new Alchemist(1, "Albertus Magnus", 1);
        Formula formula = new Formula(1, "transmutation", 1);
        alchemist.formulae.add(formula);
        school.alchemists.add(alchemist);

        nestedMap = new LinkedHashMap<>();
        nestedMap.put("alchemists", NestedRelation.many(Alchemist.class).with("formulae", NestedRelation.many(Formula.class)));
    }

    private Map<String, NestedRelation> alchemistNestedMap() {
        return nestedMap.get("alchemists").getNestedMap();
    }

    private static Map<String, Object> map(Object... keysAndValues) {
        Map<String, Object> ret = new LinkedHashMap<>();

        for (int i = 0; i < keysAndValues.length; i += 2) {
            ret.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }

        return ret;
    }

    private Map<String, Object> serializedSchool() {
        Map<String, Object> formula = map("id", 1, "title", "transmutation", "author_id", 1);
        Map<String, Object> alch = map("id", 1, "name", "Albertus Magnus", "school_id", 1, "formulae", List.of(formula));
        return map("id", 1, "name", "Bogwarts", "alchemists", List.of(alch));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void serialization() {
        GoldenMapper<WizardCollege> gm = new GoldenMapper<>(ReflectiveClassDescription.of(WizardCollege.class), nestedMap);
        Map<String, Object> serialized = gm.serialize(school);
        log.info("Serialized: " + serialized);

        assertEquals(serializedSchool(), serialized);
        assertThat(serialized.keySet()).containsExactly("id", "name", "alchemists");
        Map<String, Object> alch = ((List<Map<String, Object>>) serialized.get("alchemists")).get(0);
        assertThat(alch.keySet()).containsExactly("id", "name", "school_id", "formulae");
    }

    @Test
    public void generatedFields() {
        GoldenMapper<WizardCollege> gm = new GoldenMapper<>(ReflectiveClassDescription.of(WizardCollege.class), nestedMap);
        assertThat(gm.getFields().keySet()).containsExactly("id", "name", "alchemists");
        //identity is not nullable
        assertTrue(gm.getField("id").isRequired());
        assertThat(gm.getField("id").isAllowNull()).isFalse();
        assertThat(gm.getField("name").isRequired()).isFalse();
        assertTrue(gm.getField("name").isAllowNull());

        NestedField alchemists = (NestedField) gm.getField("alchemists");
        assertTrue(alchemists.isMany());
        assertThat(alchemists.getMapper()).isInstanceOf(GoldenMapper.class);
        assertThat(alchemists.getMapper().getFields().keySet()).containsExactly("id", "name", "school_id", "formulae");
    }

    @Test
    public void deserialization() {
        GoldenMapper<WizardCollege> gm = new GoldenMapper<>(ReflectiveClassDescription.of(WizardCollege.class), nestedMap);
        WizardCollege college = gm.deserialize(serializedSchool());

        assertNotNull(college);
        assertEquals(1, college.id);
        assertEquals("Bogwarts", college.name);
        assertEquals(1, college.alchemists.size());

        Alchemist a = college.alchemists.get(0);
        assertEquals(1, a.id);
        assertEquals("Albertus Magnus", a.name);
        assertEquals(1, a.school_id);
        assertEquals(1, a.formulae.size());

        Formula f = a.formulae.get(0);
        assertEquals(1, f.id);
        assertEquals("transmutation", f.title);
        assertEquals(1, f.author_id);
    }

    @Test
    public void deserializationNewObject() {
        MapperSettings settings = new MapperSettings().enableNewObject();
        GoldenMapper<Alchemist> gm = new GoldenMapper<>(ReflectiveClassDescription.of(Alchemist.class), alchemistNestedMap(), settings);
        assertTrue(gm.isNewObject());
        assertThat(gm.getFields()).doesNotContainKey("id");

        Map<String, Object> data = map("formulae", List.of(map("author_id", 1, "id", 1, "title", "transmutation")), "id", 1, "name", "Albertus Magnus");
        Alchemist a = gm.deserialize(data);

        assertNull(a.id);
        assertEquals("Albertus Magnus", a.name);
        assertEquals(1, a.formulae.size());
        Formula f = a.formulae.get(0);
        assertNull(f.id);
        assertEquals("transmutation", f.title);
    }

    @Test
    public void serializeSnakeToCamel() {
        GoldenMapper<Alchemist> gm = new GoldenMapper<>(ReflectiveClassDescription.of(Alchemist.class), alchemistNestedMap(), new MapperSettings().enableSnakeToCamel());
        Map<String, Object> serialized = gm.serialize(alchemist);

        Map<String, Object> expected = map("id", 1, "name", "Albertus Magnus", "schoolId", 1,
                "formulae", List.of(map("id", 1, "title", "transmutation", "authorId", 1)));
        assertEquals(expected, serialized);

        Alchemist back = gm.deserialize(serialized);
        assertEquals(1, back.school_id);
        assertEquals(1, back.formulae.get(0).author_id);
    }

    @Test
    public void serializeCamelToSnake() {
        GoldenMapper<CamelFormula> gm = GoldenMapper.forClass(CamelFormula.class, null, new MapperSettings().enableCamelToSnake());
        Map<String, Object> serialized = gm.serialize(new CamelFormula(1, "transmutation", "value"));

        assertEquals(map("id", 1, "title", "transmutation", "camel_attribute", "value"), serialized);
        CamelFormula back = gm.deserialize(serialized);
        assertEquals("value", back.camelAttribute);
    }

    @Test
    public void errorWhenSettingBothCasingTypes() {
        MapperSettings settings = new MapperSettings().enableCamelToSnake().enableSnakeToCamel();
        assertThatThrownBy(() -> GoldenMapper.forClass(Alchemist.class, null, settings))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("Only one of snake_to_camel or camel_to_snake can be True");
        assertThatThrownBy(() -> new GoldenMapper<>(ReflectiveClassDescription.of(Alchemist.class), null, true, true, false))
            .isInstanceOf(InvalidConfigurationException.class);

        GoldenMapper<Alchemist> gm = new GoldenMapper<>(ReflectiveClassDescription.of(Alchemist.class), alchemistNestedMap(), true, false, true);
        assertTrue(gm.isNewObject());
        assertEquals("schoolId", gm.getExternalName("school_id"));
    }

    @Test
    public void missingRequiredField() {
        GoldenMapper<Formula> gm = GoldenMapper.forClass(Formula.class);
        ValidationException ex = assertThrows(ValidationException.class, () -> gm.deserialize(map("title", "x")));
        assertThat(ex.getFieldNames()).containsExactly("id");
        assertThat(ex.getMessages("id")).containsExactly("Missing data for required field.");
    }

    @Test
    public void errorsOfAllFieldsAreReported() {
        GoldenMapper<Formula> gm = GoldenMapper.forClass(Formula.class);
        ValidationException ex = assertThrows(ValidationException.class, () -> gm.deserialize(map("id", "abc", "title", 5, "author_id", null)));
        log.info("Expected error: " + ex.getMessage());
        assertThat(ex.getMessages()).hasSize(2);
        assertThat(ex.getMessages("id")).containsExactly("Not a valid integer.");
        assertThat(ex.getMessages("title")).containsExactly("Not a valid string.");
    }

    @Test
    public void nestedErrorsHavePaths() {
        GoldenMapper<WizardCollege> gm = new GoldenMapper<>(ReflectiveClassDescription.of(WizardCollege.class), nestedMap);
        Map<String, Object> data = map("id", 1, "name", "Bogwarts",
                "alchemists", List.of(map("name", 5, "formulae", List.of(map("id", 2, "title", "ok"), map("title", "no id")))));

        ValidationException ex = assertThrows(ValidationException.class, () -> gm.deserialize(data));
        assertThat(ex.getFieldNames()).containsExactlyInAnyOrder("alchemists.0.id", "alchemists.0.name", "alchemists.0.formulae.1.id");
        assertThat(ex.getMessages("alchemists.0.name")).containsExactly("Not a valid string.");
        assertThat(ex.getMessages("alchemists.0.formulae.1.id")).containsExactly("Missing data for required field.");
    }

    @Test
    public void manualFieldsWin() {
        Map<String, MappedField> declared = new LinkedHashMap<>();
        declared.put("name", Fields.method(o -> ((Alchemist) o).name.toUpperCase()));
        declared.put("formula_count", Fields.method(o -> ((Alchemist) o).formulae.size()));
        GoldenMapper<Alchemist> gm = new GoldenMapper<>(ReflectiveClassDescription.of(Alchemist.class), alchemistNestedMap(), new MapperSettings(), declared);

        assertThat(gm.getField("name")).isInstanceOf(MethodField.class);
        assertThat(gm.getFields().keySet()).containsExactly("name", "formula_count", "id", "school_id", "formulae");

        Map<String, Object> serialized = gm.serialize(alchemist);
        assertEquals("ALBERTUS MAGNUS", serialized.get("name"));
        assertEquals(1, serialized.get("formula_count"));
    }

    @Test
    public void manualIdentityFieldKeptForNewObjects() {
        Map<String, MappedField> declared = new LinkedHashMap<>();
        declared.put("id", Fields.integer());
        GoldenMapper<Formula> gm = new GoldenMapper<>(ReflectiveClassDescription.of(Formula.class), null, new MapperSettings().enableNewObject(), declared);
        assertThat(gm.getFields()).containsKey("id");
        assertEquals(3, gm.deserialize(map("id", 3, "title", "x")).id);
    }

    @Test
    public void relationWithoutNestedEntry() {
        assertThatThrownBy(() -> GoldenMapper.forClass(Cauldron.class))
            .isInstanceOfSatisfying(UnsupportedTypeException.class, e -> {
                assertEquals("recipe", e.getAttribute());
                assertEquals(AttributeType.NESTED_REFERENCE, e.getType());
            });
    }

    @Test
    public void singleNestedRelation() {
        Map<String, NestedRelation> nested = new HashMap<>();
        nested.put("recipe", NestedRelation.one(Formula.class));
        GoldenMapper<Cauldron> gm = GoldenMapper.forClass(Cauldron.class, nested, new MapperSettings().enableSnakeToCamel());

        Cauldron c = new Cauldron();
        c.id = 4;
        c.recipe = new Formula(2, "gold", 1);
        Map<String, Object> serialized = gm.serialize(c);
        assertEquals(map("id", 4, "recipe", map("id", 2, "title", "gold", "authorId", 1)), serialized);

        Cauldron back = gm.deserialize(serialized);
        assertEquals("gold", back.recipe.title);
        assertEquals(1, back.recipe.author_id);

        c.recipe = null;
        assertThat(gm.serialize(c)).containsEntry("recipe", null);
        assertNull(gm.deserialize(map("id", 4, "recipe", null)).recipe);
    }

    @Test
    public void unsupportedAttributeTypes() {
        SimpleClassDescription<HashMap> arrayOfArrays = SimpleClassDescription.builder(HashMap.class)
            .attribute(AttributeDescriptor.arrayOf("grid", AttributeType.ARRAY, true))
            .factory(values -> new HashMap<>(values))
            .build();
        assertThatThrownBy(() -> new GoldenMapper<>(arrayOfArrays)).isInstanceOf(UnsupportedTypeException.class).hasMessageContaining("grid");

        SimpleClassDescription<HashMap> enumWithoutClass = SimpleClassDescription.builder(HashMap.class)
            .attribute(AttributeDescriptor.of("kind", AttributeType.ENUM, true))
            .factory(values -> new HashMap<>(values))
            .build();
        assertThatThrownBy(() -> new GoldenMapper<>(enumWithoutClass)).isInstanceOf(UnsupportedTypeException.class);

        SimpleClassDescription<HashMap> auto = SimpleClassDescription.builder(HashMap.class)
            .attribute(AttributeDescriptor.of("x", AttributeType.AUTO, true))
            .factory(values -> new HashMap<>(values))
            .build();
        assertThatThrownBy(() -> new GoldenMapper<>(auto)).isInstanceOf(UnsupportedTypeException.class).hasMessageContaining("no codec registered");
    }

    @Test
    public void nestingDepthLimit() {
        assertThatThrownBy(() -> GoldenMapper.forClass(WizardCollege.class, nestedMap, new MapperSettings().setMaxNestingDepth(2)))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("Formula");
        assertNotNull(GoldenMapper.forClass(WizardCollege.class, nestedMap, new MapperSettings().setMaxNestingDepth(3)));
    }

    @Test
    public void unexpectedAttributeOnReconstruction() {
        //a manual field without counterpart in the class
        Map<String, MappedField> declared = new LinkedHashMap<>();
        declared.put("color", Fields.string());
        GoldenMapper<Formula> gm = new GoldenMapper<>(ReflectiveClassDescription.of(Formula.class), null, new MapperSettings(), declared);
        assertThatThrownBy(() -> gm.deserialize(map("id", 1, "color", "red")))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("unexpected attribute 'color'");
    }

    @Test
    public void listsAndJson() {
        GoldenMapper<WizardCollege> gm = new GoldenMapper<>(ReflectiveClassDescription.of(WizardCollege.class), nestedMap);
        String json = gm.toJson(school);
        log.info("Json: " + json);
        WizardCollege back = gm.fromJson(json);
        assertEquals("Bogwarts", back.name);
        assertEquals("transmutation", back.alchemists.get(0).formulae.get(0).title);

        GoldenMapper<Formula> fm = GoldenMapper.forClass(Formula.class);
        List<Map<String, Object>> serialized = fm.serializeList(List.of(new Formula(1, "a", 1), new Formula(2, "b", 1)));
        assertThat(serialized).hasSize(2);
        List<Formula> formulae = fm.deserializeList(serialized);
        assertEquals("b", formulae.get(1).title);

        List<Object> broken = new ArrayList<>(serialized);
        broken.add(map("title", "c"));
        broken.add("nothing");
        ValidationException ex = assertThrows(ValidationException.class, () -> fm.deserializeList(broken));
        assertThat(ex.getFieldNames()).containsExactly("2.id", "3");
    }

    @Test
    public void mapperIsThreadSafe() throws Exception {
        GoldenMapper<WizardCollege> gm = new GoldenMapper<>(ReflectiveClassDescription.of(WizardCollege.class), nestedMap);
        Map<String, Object> expected = serializedSchool();
        ExecutorService exec = Executors.newFixedThreadPool(8);

        try {
            List<Future<Map<String, Object>>> results = new ArrayList<>();

            for (int i = 0; i < 100; i++) {
                results.add(exec.submit(() -> gm.serialize(gm.deserialize(expected))));
            }

            for (Future<Map<String, Object>> f : results) {
                assertEquals(expected, f.get(10, TimeUnit.SECONDS));
            }
        } finally {
            exec.shutdownNow();
        }
    }

    @Test
    public void integerOverflowOnSerialization() {
        GoldenMapper<Tally> gm = GoldenMapper.forClass(Tally.class);
        Tally t = new Tally();
        t.id = 1;
        t.count = 5_000L;
        assertEquals(5_000, gm.serialize(t).get("count"));

        t.count = 5_000_000_000L;
        assertThatThrownBy(() -> gm.serialize(t))
            .isInstanceOf(InvalidConfigurationException.class)
            .hasMessageContaining("count");
    }

    @Test
    public void shortRangeOnDeserialization() {
        GoldenMapper<Gauge> gm = GoldenMapper.forClass(Gauge.class);
        Gauge g = gm.deserialize(map("id", 1, "level", 1234));
        assertEquals(Short.valueOf((short) 1234), g.level);
        assertEquals(1234, gm.serialize(g).get("level"));

        ValidationException ex = assertThrows(ValidationException.class, () -> gm.deserialize(map("id", 1, "level", 40000)));
        assertThat(ex.getFieldNames()).containsExactly("level");
        assertThat(ex.getMessages("level")).containsExactly("Not a valid integer.");
    }
}
