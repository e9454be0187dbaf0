package com.omniva.pglistener.jdbc.insert;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Column layout of a record class, walked once and cached by {@link InsertBuilder}.
 * <p>
 * A class's own fields come first in declaration order, then the fields of each
 * {@link DbEmbedded} field, depth first. When two fields map to the same column the
 * first one found wins.
 * <p>
 * For Java records the order is the record component order. For other classes it is the order
 * {@link Class#getDeclaredFields()} reports, which the JDK does not specify but HotSpot keeps
 * as declared. Inherited instance fields are rejected rather than silently dropped; use
 * {@link DbEmbedded} to share columns between record classes.
 */
final class RecordSchema {

    private final Class<?> recordType;
    private final List<ColumnDescriptor> columns;

    private RecordSchema(Class<?> recordType, List<ColumnDescriptor> columns) {
        this.recordType = recordType;
        this.columns = List.copyOf(columns);
    }

    static RecordSchema of(Class<?> recordType) {
        List<ColumnDescriptor> columns = new ArrayList<>();
        scan(recordType, List.of(), new HashSet<>(), columns);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No insertable fields in " + recordType.getName());
        }
        return new RecordSchema(recordType, columns);
    }

    private static void scan(Class<?> type, List<Field> parentPath, Set<String> seen, List<ColumnDescriptor> columns) {
        List<Field> embedded = new ArrayList<>();

        for (Field field : instanceFields(type)) {
            if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) {
                continue;
            }

            if (field.isAnnotationPresent(DbEmbedded.class)) {
                embedded.add(field);
                continue;
            }

            DbColumn column = field.getAnnotation(DbColumn.class);
            if (column != null && (column.skip() || "-".equals(column.value()))) {
                continue;
            }

            boolean named = column != null && !column.value().isEmpty();
            String name = named ? column.value() : field.getName();
            if (!seen.add(name)) {
                continue;
            }

            field.setAccessible(true);
            columns.add(new ColumnDescriptor(name, named, column != null && column.asString(), append(parentPath, field)));
        }

        for (Field field : embedded) {
            field.setAccessible(true);
            scan(field.getType(), append(parentPath, field), seen, columns);
        }
    }

    private static List<Field> instanceFields(Class<?> type) {
        for (Class<?> parent = type.getSuperclass(); parent != null && parent != Object.class && parent != Record.class;
             parent = parent.getSuperclass()) {
            for (Field field : parent.getDeclaredFields()) {
                if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                    throw new IllegalArgumentException("Inherited field " + parent.getSimpleName() + "." + field.getName()
                            + " is not supported in " + type.getName() + "; use @DbEmbedded instead");
                }
            }
        }

        if (!type.isRecord()) {
            return Arrays.asList(type.getDeclaredFields());
        }
        List<Field> fields = new ArrayList<>();
        for (RecordComponent component : type.getRecordComponents()) {
            try {
                fields.add(type.getDeclaredField(component.getName()));
            } catch (NoSuchFieldException e) {
                throw new IllegalStateException("No field behind record component " + component.getName(), e);
            }
        }
        return fields;
    }

    private static List<Field> append(List<Field> path, Field field) {
        List<Field> extended = new ArrayList<>(path);
        extended.add(field);
        return List.copyOf(extended);
    }

    Class<?> recordType() {
        return recordType;
    }

    List<ColumnDescriptor> columns() {
        return columns;
    }

    List<Object> values(Object record) {
        List<Object> values = new ArrayList<>(columns.size());
        for (ColumnDescriptor column : columns) {
            values.add(column.read(record));
        }
        return values;
    }
}
