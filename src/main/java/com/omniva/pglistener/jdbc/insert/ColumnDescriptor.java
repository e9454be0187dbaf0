package com.omniva.pglistener.jdbc.insert;

import java.lang.reflect.Field;
import java.util.List;

/**
 * One inserted column: its name and the field path leading to its value
 *
 * @param path fields walked from the root record, embedded owners first
 */
record ColumnDescriptor(String name, boolean quoted, boolean asString, List<Field> path) {

    String sqlName() {
        return quoted ? '"' + name.replace("\"", "\"\"") + '"' : name;
    }

    Object read(Object record) {
        Object current = record;
        for (Field field : path) {
            if (current == null) {
                return null;
            }
            try {
                current = field.get(current);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot read field " + field + " for column " + name, e);
            }
        }
        if (asString && current != null) {
            return String.valueOf(current);
        }
        return current;
    }
}
