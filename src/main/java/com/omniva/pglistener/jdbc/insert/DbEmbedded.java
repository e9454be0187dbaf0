package com.omniva.pglistener.jdbc.insert;

import java.lang.annotation.*;

/**
 * Flatten the fields of the annotated field's value into the owning record's columns.
 * Nested columns come after the owner's own columns.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface DbEmbedded {
}
