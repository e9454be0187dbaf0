package com.omniva.pglistener.jdbc.insert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds parameterised PostgreSQL INSERT statements from record objects.
 * <p>
 * <pre>{@code
 * InsertStatement insert = InsertBuilder.build(InsertOptions.builder()
 *         .table("orders")
 *         .record(order)
 *         .suffix("RETURNING id")
 *         .build());
 * // INSERT INTO "orders" (id,"customer_ref",total) VALUES ($1,$2,$3) RETURNING id
 * }</pre>
 * Column mapping is described on {@link DbColumn} and {@link DbEmbedded}. Statement text
 * is cached per table, prefix, suffix and record class; the same inputs always give the
 * same text and argument order. Thread-safe.
 */
public final class InsertBuilder {

    private static final Logger log = LoggerFactory.getLogger(InsertBuilder.class);

    private static final Map<Class<?>, RecordSchema> SCHEMA_CACHE = new ConcurrentHashMap<>();
    private static final Map<StatementKey, String> STATEMENT_CACHE = new ConcurrentHashMap<>();

    private record StatementKey(String table, String prefix, String suffix, Class<?> recordType) {
    }

    private InsertBuilder() {
    }

    public static InsertStatement build(InsertOptions options) {
        if (options.getTable() == null || options.getTable().isEmpty()) {
            throw new IllegalArgumentException("Table is required");
        }
        if (options.getRecord() == null) {
            throw new IllegalArgumentException("Record is required for table " + options.getTable());
        }

        Class<?> recordType = options.getRecord().getClass();
        RecordSchema schema = SCHEMA_CACHE.computeIfAbsent(recordType, RecordSchema::of);

        StatementKey key = new StatementKey(options.getTable(), nullToEmpty(options.getPrefix()),
                nullToEmpty(options.getSuffix()), recordType);
        String sql = STATEMENT_CACHE.computeIfAbsent(key, k -> render(k, schema));

        return new InsertStatement(sql, schema.values(options.getRecord()));
    }

    private static String render(StatementKey key, RecordSchema schema) {
        StringBuilder sql = new StringBuilder();
        if (!key.prefix().isEmpty()) {
            sql.append(key.prefix()).append(' ');
        }
        sql.append("INSERT INTO \"").append(key.table().replace("\"", "\"\"")).append("\" (");

        int count = schema.columns().size();
        for (int i = 0; i < count; i++) {
            if (i != 0) {
                sql.append(',');
            }
            sql.append(schema.columns().get(i).sqlName());
        }

        sql.append(") VALUES (");
        for (int i = 1; i <= count; i++) {
            if (i != 1) {
                sql.append(',');
            }
            sql.append('$').append(i);
        }
        sql.append(')');

        if (!key.suffix().isEmpty()) {
            sql.append(' ').append(key.suffix());
        }

        log.debug("Cached insert statement for {}: {}", key.recordType().getSimpleName(), sql);
        return sql.toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
