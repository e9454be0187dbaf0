package com.omniva.pglistener.jdbc.insert;

import lombok.Builder;
import lombok.Getter;

/**
 * What {@link InsertBuilder} writes and where
 */
@Getter
@Builder
public class InsertOptions {

    /**
     * Table to insert into. Required.
     */
    private final String table;

    /**
     * Record whose instance fields become the inserted columns. Required.
     */
    private final Object record;

    /**
     * Optional text placed before the statement, e.g. a {@code WITH} clause
     */
    private final String prefix;

    /**
     * Optional text placed after the statement, e.g. {@code RETURNING id}
     */
    private final String suffix;
}
