package com.heronix.autograder.store;

import java.util.List;
import java.util.Map;

import reactor.core.publisher.Mono;

/**
 * Boundary to the record store that persists classes, assignments and
 * submission batches.
 *
 * Rows travel in the store's own naming convention (snake_case keys). Every
 * call is lazy: nothing is sent until the returned {@link Mono} is subscribed.
 * Failures are signalled as {@link com.heronix.autograder.exception.PersistenceException}.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
public interface RecordStore {

    /**
     * Short name of the implementation, reported by the health indicator.
     */
    String getMode();

    /**
     * Fetch one row by identifier.
     *
     * @param table table name (e.g. "assignments")
     * @param id    row identifier
     * @return the row, or an empty Mono when no row has that identifier
     */
    Mono<Map<String, Object>> findById(String table, String id);

    /**
     * Fetch all rows matching a query, in the query's order.
     */
    Mono<List<Map<String, Object>>> select(RecordQuery query);

    /**
     * Apply a partial update to one row, atomically.
     *
     * @param table table name
     * @param id    row identifier
     * @param patch snake_case columns to overwrite
     * @return the updated row, or an empty Mono when no row has that identifier
     */
    Mono<Map<String, Object>> update(String table, String id, Map<String, Object> patch);

    /**
     * Insert a row. The store assigns the identifier and creation timestamp.
     *
     * @return the inserted row as stored
     */
    Mono<Map<String, Object>> insert(String table, Map<String, Object> row);

    /**
     * Check if the store answers at all. Blocks briefly.
     */
    boolean isAvailable();
}
