package com.omniva.pglistener.jdbc.insert;

import java.lang.annotation.*;

/**
 * Column mapping for a record field written by {@link InsertBuilder}.
 * <p>
 * Fields without this annotation map to their field name, unquoted.
 */
@Target(ElementType.FIELD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface DbColumn {

    /**
     * Column name, quoted in the statement. Empty keeps the field name unquoted.
     * {@code "-"} skips the field.
     */
    String value() default "";

    /**
     * Bind the value as {@code String.valueOf(value)}, e.g. for PostgreSQL domains
     */
    boolean asString() default false;

    /**
     * Leave the field out of the statement
     */
    boolean skip() default false;
}
