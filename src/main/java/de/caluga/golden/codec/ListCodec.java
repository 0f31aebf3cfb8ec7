package de.caluga.golden.codec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Lists of one element type. Null elements are kept as null.
 *
 * @param <E> element type
 */
public class ListCodec<E> implements TypeCodec<Collection<E>> {

    private final TypeCodec<E> elementCodec;

    public ListCodec(TypeCodec<E> elementCodec) {
        this.elementCodec = elementCodec;
    }

    public TypeCodec<E> getElementCodec() {
        return elementCodec;
    }

    @Override
    public Object marshall(Collection<E> o) {
        List<Object> ret = new ArrayList<>(o.size());

        for (E e : o) {
            ret.add(e == null ? null : elementCodec.marshall(e));
        }

        return ret;
    }

    @Override
    public List<E> unmarshall(Object d) {
        if (!(d instanceof Collection)) {
            throw new IllegalArgumentException("Not a valid list.");
        }

        List<E> ret = new ArrayList<>();
        int idx = 0;

        for (Object o : (Collection<?>) d) {
            try {
                ret.add(o == null ? null : elementCodec.unmarshall(o));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Item " + idx + ": " + e.getMessage(), e);
            }

            idx++;
        }

        return ret;
    }
}
