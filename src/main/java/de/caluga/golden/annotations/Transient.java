package de.caluga.golden.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;

/**
 * field is ignored when describing a class
 */
@Target({FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface Transient {
}
