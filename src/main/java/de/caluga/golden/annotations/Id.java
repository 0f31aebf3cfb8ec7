package de.caluga.golden.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;

/**
 * Marks the identity attribute of a class. It is never nullable and is left out of generated fields when
 * mapping into new objects. Without this annotation a field named {@code id} is used.
 */
@Target({FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface Id {
}
