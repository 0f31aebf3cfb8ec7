package de.caluga.golden.annotations;

import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.FIELD;

/**
 * Field holds related objects (one or a list). Relations are not attributes: they are only mapped when a
 * nested relation is configured for them, but they can always be set when instances are reconstructed.
 */
@Target({FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface Relation {
}
