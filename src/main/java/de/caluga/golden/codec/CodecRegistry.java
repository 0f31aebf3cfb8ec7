package de.caluga.golden.codec;

import de.caluga.golden.UnsupportedTypeException;
import de.caluga.golden.description.AttributeDescriptor;
import de.caluga.golden.description.AttributeType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Function;

/**
 * The fixed mapping of attribute types to codecs. Lookups happen when a mapper is built, never while data
 * is converted.
 */
@SuppressWarnings({"unchecked", "rawtypes"})
public final class CodecRegistry {

    private static final Map<AttributeType, Function<AttributeDescriptor, TypeCodec<?>>> CODECS;

    static {
        Map<AttributeType, Function<AttributeDescriptor, TypeCodec<?>>> m = new EnumMap<>(AttributeType.class);
        StringCodec string = new StringCodec();
        IntegerCodec integer = new IntegerCodec();
        ShortCodec shortInteger = new ShortCodec();
        LongCodec longInteger = new LongCodec();
        BooleanCodec bool = new BooleanCodec();
        DateCodec date = new DateCodec();
        UuidCodec uuid = new UuidCodec();
        RawCodec raw = new RawCodec();
        m.put(AttributeType.STRING, a -> string);
        m.put(AttributeType.INTEGER, a -> Short.class.equals(a.getValueClass()) || short.class.equals(a.getValueClass()) ? shortInteger : integer);
        m.put(AttributeType.LONG, a -> longInteger);
        m.put(AttributeType.BOOLEAN, a -> bool);
        m.put(AttributeType.DATE, a -> date);
        m.put(AttributeType.UUID, a -> uuid);
        m.put(AttributeType.RAW, a -> raw);
        m.put(AttributeType.TIMESTAMP, CodecRegistry::timestampCodec);
        m.put(AttributeType.ENUM, CodecRegistry::enumCodec);
        m.put(AttributeType.ARRAY, CodecRegistry::listCodec);
        CODECS = Collections.unmodifiableMap(m);
    }

    private CodecRegistry() {
    }

    public static boolean isSupported(AttributeType type) {
        return CODECS.containsKey(type);
    }

    /**
     * @throws UnsupportedTypeException if there is no codec for the declared type, or it is incomplete
     *                                  (enum without enum class, list of lists)
     */
    public static TypeCodec<?> codecFor(AttributeDescriptor a) {
        Function<AttributeDescriptor, TypeCodec<?>> f = CODECS.get(a.getType());

        if (f == null) {
            throw new UnsupportedTypeException(a.getName(), a.getType(), "no codec registered");
        }

        return f.apply(a);
    }

    public static EnumCodec enumCodec(AttributeDescriptor a) {
        Class<?> cls = a.getValueClass();

        if (cls == null || !cls.isEnum()) {
            throw new UnsupportedTypeException(a.getName(), AttributeType.ENUM, "enum class missing, got " + cls);
        }

        return new EnumCodec((Class<? extends Enum>) cls);
    }

    private static TimestampCodec timestampCodec(AttributeDescriptor a) {
        Class<?> cls = a.getValueClass();

        if (cls == null) {
            return new TimestampCodec();
        }

        if (!TimestampCodec.isSupported(cls)) {
            throw new UnsupportedTypeException(a.getName(), AttributeType.TIMESTAMP, cls.getName() + " is not a timestamp class");
        }

        return new TimestampCodec(cls);
    }

    private static ListCodec<?> listCodec(AttributeDescriptor a) {
        AttributeType elementType = a.getElementType();

        if (elementType == null || !elementType.isScalar()) {
            throw new UnsupportedTypeException(a.getName(), AttributeType.ARRAY, "element type must be a scalar type, got " + elementType);
        }

        return new ListCodec(codecFor(a.elementDescriptor()));
    }
}
