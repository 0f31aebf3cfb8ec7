package de.caluga.golden.annotations;

import de.caluga.golden.description.AttributeType;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;

/**
 * Describes an attribute explicitly. Usually not necessary, all non static fields are attributes by default
 * and their type is derived from the java type. Use it to make an attribute mandatory or to state the
 * element type of a list, which is erased at runtime.
 */
@Target({FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface Column {
    /**
     * {@link AttributeType#AUTO}: derive from field type
     */
    AttributeType type() default AttributeType.AUTO;

    /**
     * only used for {@link AttributeType#ARRAY}
     */
    AttributeType elementType() default AttributeType.AUTO;

    boolean nullable() default true;
}
