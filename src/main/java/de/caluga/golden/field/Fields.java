package de.caluga.golden.field;

import de.caluga.golden.CaseChangingMapper;
import de.caluga.golden.CasingPolicy;
import de.caluga.golden.codec.BooleanCodec;
import de.caluga.golden.codec.DateCodec;
import de.caluga.golden.codec.EnumCodec;
import de.caluga.golden.codec.IntegerCodec;
import de.caluga.golden.codec.ListCodec;
import de.caluga.golden.codec.LongCodec;
import de.caluga.golden.codec.RawCodec;
import de.caluga.golden.codec.StringCodec;
import de.caluga.golden.codec.TimestampCodec;
import de.caluga.golden.codec.TypeCodec;
import de.caluga.golden.codec.UuidCodec;

import java.util.function.Function;

/**
 * Factory for manually declared fields. All of them start out optional and not nullable:
 *
 * <pre>
 * Map&lt;String, MappedField&gt; fields = new LinkedHashMap&lt;&gt;();
 * fields.put("attr_one", Fields.string().required());
 * fields.put("attr_two", Fields.integer().allowNull());
 * </pre>
 */
public final class Fields {

    private Fields() {
    }

    public static <T> ValueField<T> of(TypeCodec<T> codec) {
        return new ValueField<>(codec);
    }

    public static ValueField<String> string() {
        return of(new StringCodec());
    }

    public static ValueField<Number> integer() {
        return of(new IntegerCodec());
    }

    public static ValueField<Number> longInteger() {
        return of(new LongCodec());
    }

    public static ValueField<Boolean> bool() {
        return of(new BooleanCodec());
    }

    public static MappedField date() {
        return of(new DateCodec());
    }

    public static MappedField timestamp(Class<?> javaType) {
        return of(new TimestampCodec(javaType));
    }

    public static MappedField uuid() {
        return of(new UuidCodec());
    }

    public static MappedField raw() {
        return of(new RawCodec());
    }

    public static <E> MappedField list(TypeCodec<E> elementCodec) {
        return of(new ListCodec<>(elementCodec));
    }

    public static MappedField enumeration(Class<? extends Enum<?>> enumType) {
        return enumeration(enumType, CasingPolicy.NONE);
    }

    public static MappedField enumeration(Class<? extends Enum<?>> enumType, CasingPolicy casing) {
        return new EnumField(new EnumCodec(enumType), casing);
    }

    public static MappedField nested(CaseChangingMapper mapper) {
        return new NestedField(mapper, false);
    }

    public static MappedField nestedList(CaseChangingMapper mapper) {
        return new NestedField(mapper, true);
    }

    public static MappedField method(Function<Object, Object> method) {
        return new MethodField(method);
    }
}
