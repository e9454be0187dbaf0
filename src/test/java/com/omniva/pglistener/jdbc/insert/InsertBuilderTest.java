package com.omniva.pglistener.jdbc.insert;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class InsertBuilderTest {

    static class Simple {
        String f1;
        int f2;

        Simple(String f1, int f2) {
            this.f1 = f1;
            this.f2 = f2;
        }
    }

    static class Tagged {
        @DbColumn("field_1")
        String f1;
        @DbColumn(value = "field_2", asString = true)
        int f2;
        @DbColumn(asString = true)
        UUID ref;
        @DbColumn(skip = true)
        String transientNote;
        @DbColumn("-")
        String alsoSkipped;
        static String ignoredStatic = "x";
    }

    static class Inner {
        int f3;
        Inner(int f3) {
            this.f3 = f3;
        }
    }

    static class Outer {
        String f1 = "aaa";
        @DbEmbedded
        Inner inner = new Inner(3);
        int f2 = 1;
    }

    static class Overlapping {
        int f2;
        Overlapping(int f2) {
            this.f2 = f2;
        }
    }

    static class OwnerWins {
        @DbEmbedded
        Overlapping overlapping = new Overlapping(3);
        String f1 = "aaa";
        int f2 = 1;
    }

    record Wide(String f1, int f2, int f3, int f4, int f5, int f6, int f7, int f8, int f9, int f10) {
    }

    record Reordered(int f2, String f1) {
    }

    static class Base {
        String createdBy = "system";
    }

    static class Derived extends Base {
        String f1 = "aaa";
    }

    private static InsertStatement build(String table, Object record) {
        return InsertBuilder.build(InsertOptions.builder().table(table).record(record).build());
    }

    @Test
    void simpleRecord() {
        InsertStatement insert = build("t1", new Simple("aaa", 1));

        assertEquals("INSERT INTO \"t1\" (f1,f2) VALUES ($1,$2)", insert.sql());
        assertEquals(List.of("aaa", 1), insert.args());
    }

    @Test
    void identicalInputsGiveIdenticalStatements() {
        InsertStatement first = build("t1", new Simple("aaa", 1));
        InsertStatement second = build("t1", new Simple("aaa", 1));

        assertSame(first.sql(), second.sql());
        assertEquals(first.args(), second.args());
    }

    @Test
    void namedSkippedAndStringColumns() {
        Tagged record = new Tagged();
        record.f1 = "aaa";
        record.f2 = 1;
        record.ref = null;
        record.transientNote = "note";

        InsertStatement insert = build("t1", record);

        assertEquals("INSERT INTO \"t1\" (\"field_1\",\"field_2\",ref) VALUES ($1,$2,$3)", insert.sql());
        assertEquals(Arrays.asList("aaa", "1", null), insert.args());
    }

    @Test
    void skippingFieldRemovesColumnAndArgument() {
        Tagged record = new Tagged();
        record.transientNote = "note";

        InsertStatement insert = build("t1", record);

        assertFalse(insert.sql().contains("transientNote"));
        assertFalse(insert.args().contains("note"));
        assertEquals(3, insert.args().size());
    }

    @Test
    void prefixAndSuffix() {
        InsertStatement insert = InsertBuilder.build(InsertOptions.builder()
                .table("t1")
                .record(new Simple("aaa", 1))
                .prefix("with v as (select 1)")
                .suffix("returning f1")
                .build());

        assertEquals("with v as (select 1) INSERT INTO \"t1\" (f1,f2) VALUES ($1,$2) returning f1", insert.sql());
    }

    @Test
    void embeddedFieldsComeAfterOwnFields() {
        InsertStatement insert = build("t1", new Outer());

        assertEquals("INSERT INTO \"t1\" (f1,f2,f3) VALUES ($1,$2,$3)", insert.sql());
        assertEquals(List.of("aaa", 1, 3), insert.args());
    }

    @Test
    void ownerFieldWinsOverEmbeddedDuplicate() {
        InsertStatement insert = build("t2", new OwnerWins());

        assertEquals("INSERT INTO \"t2\" (f1,f2) VALUES ($1,$2)", insert.sql());
        assertEquals(List.of("aaa", 1), insert.args());
    }

    @Test
    void nullEmbeddedValueBindsNulls() {
        Outer record = new Outer();
        record.inner = null;

        assertEquals(Arrays.asList("aaa", 1, null), build("t1", record).args());
    }

    @Test
    void manyColumnsNumberPastNine() {
        InsertStatement insert = build("t1", new Wide("aaa", 1, 2, 3, 4, 5, 6, 7, 8, 9));

        assertEquals("INSERT INTO \"t1\" (f1,f2,f3,f4,f5,f6,f7,f8,f9,f10) "
                + "VALUES ($1,$2,$3,$4,$5,$6,$7,$8,$9,$10)", insert.sql());
        assertEquals(List.of("aaa", 1, 2, 3, 4, 5, 6, 7, 8, 9), insert.args());
    }

    @Test
    void jdbcFormRewritesOnlyValuePlaceholders() {
        InsertStatement insert = InsertBuilder.build(InsertOptions.builder()
                .table("t1")
                .record(new Simple("aaa", 1))
                .suffix("returning '$1'")
                .build());

        assertEquals("INSERT INTO \"t1\" (f1,f2) VALUES (?,?) returning '$1'", insert.toJdbcSql());
    }

    @Test
    void requiresTableAndRecord() {
        assertThrows(IllegalArgumentException.class, () -> build("", new Simple("a", 1)));
        assertThrows(IllegalArgumentException.class, () -> build("t1", null));
    }

    @Test
    void recordColumnsFollowComponentOrder() {
        InsertStatement insert = build("t1", new Reordered(7, "aaa"));

        assertEquals("INSERT INTO \"t1\" (f2,f1) VALUES ($1,$2)", insert.sql());
        assertEquals(List.of(7, "aaa"), insert.args());
    }

    @Test
    void rejectsInheritedFields() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> build("t1", new Derived()));

        assertTrue(e.getMessage().contains("Base.createdBy"));
    }
}
