package com.heronix.autograder.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equality-filtered, optionally ordered select over one table.
 *
 * @param table     table name
 * @param filters   column -> required value, all must match
 * @param orderBy   column to order by, or null for store order
 * @param ascending order direction
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
public record RecordQuery(
        String table,
        Map<String, Object> filters,
        String orderBy,
        boolean ascending
) {

    public RecordQuery {
        filters = Collections.unmodifiableMap(new LinkedHashMap<>(filters));
    }

    public static RecordQuery from(String table) {
        return new RecordQuery(table, Map.of(), null, true);
    }

    public RecordQuery where(String column, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(filters);
        next.put(column, value);
        return new RecordQuery(table, next, orderBy, ascending);
    }

    public RecordQuery orderBy(String column, boolean ascendingOrder) {
        return new RecordQuery(table, filters, column, ascendingOrder);
    }
}
