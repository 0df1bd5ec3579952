package com.heronix.autograder.store.memory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.heronix.autograder.exception.PersistenceException;
import com.heronix.autograder.store.RecordQuery;
import com.heronix.autograder.store.RecordStore;
import com.heronix.autograder.store.Timestamps;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Record store kept in process memory.
 *
 * Behaves like the REST store as far as the services can tell: it assigns
 * identifiers and created_at on insert, updates rows atomically, and hands
 * out copies so callers never alias stored rows. Used for local runs
 * (heronix.autograder.store.mode=memory) and tests.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Component
@ConditionalOnProperty(name = "heronix.autograder.store.mode", havingValue = "memory")
@Slf4j
public class InMemoryRecordStore implements RecordStore {

    private final Clock clock;
    private final Map<String, Map<String, Map<String, Object>>> tables = new ConcurrentHashMap<>();

    public InMemoryRecordStore(Clock clock) {
        this.clock = clock;
        log.info("MEMORY_STORE: Initialized - records are not persisted across restarts");
    }

    @Override
    public String getMode() {
        return "memory";
    }

    @Override
    public Mono<Map<String, Object>> findById(String table, String id) {
        return Mono.fromCallable(() -> copy(table(table).get(id)));
    }

    @Override
    public Mono<List<Map<String, Object>>> select(RecordQuery query) {
        return Mono.fromCallable(() -> {
            var rows = table(query.table()).values().stream()
                    .filter(row -> matches(row, query.filters()))
                    .map(InMemoryRecordStore::copy);

            if (query.orderBy() != null) {
                Comparator<Map<String, Object>> order =
                        (a, b) -> compareValues(a.get(query.orderBy()), b.get(query.orderBy()));
                rows = rows.sorted(query.ascending() ? order : order.reversed());
            }
            return rows.toList();
        });
    }

    @Override
    public Mono<Map<String, Object>> update(String table, String id, Map<String, Object> patch) {
        return Mono.fromCallable(() -> {
            Map<String, Object> updated = table(table).computeIfPresent(id, (key, current) -> {
                Map<String, Object> next = new LinkedHashMap<>(current);
                next.putAll(patch);
                next.put("id", key);
                return next;
            });
            return copy(updated);
        });
    }

    @Override
    public Mono<Map<String, Object>> insert(String table, Map<String, Object> row) {
        return Mono.fromCallable(() -> {
            Map<String, Object> stored = new LinkedHashMap<>();
            Object requestedId = row.get("id");
            String id = requestedId != null ? requestedId.toString() : UUID.randomUUID().toString();
            stored.put("id", id);
            stored.putAll(row);
            stored.put("id", id);
            stored.putIfAbsent("created_at", Timestamps.now(clock));

            if (table(table).putIfAbsent(id, stored) != null) {
                throw new PersistenceException(table,
                        "duplicate key value violates unique constraint: " + table + ".id=" + id);
            }
            log.debug("MEMORY_STORE: inserted table={} id={}", table, id);
            return copy(stored);
        });
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Drop every row of every table.
     */
    public void clear() {
        tables.clear();
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private Map<String, Map<String, Object>> table(String name) {
        return tables.computeIfAbsent(name, key -> new ConcurrentHashMap<>());
    }

    private static boolean matches(Map<String, Object> row, Map<String, Object> filters) {
        for (Map.Entry<String, Object> filter : filters.entrySet()) {
            Object actual = row.get(filter.getKey());
            Object expected = filter.getValue();
            if (!Objects.equals(asText(actual), asText(expected))) {
                return false;
            }
        }
        return true;
    }

    private static String asText(Object value) {
        return value != null ? value.toString() : null;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compareValues(Object a, Object b) {
        if (a == null || b == null) {
            return a == null ? (b == null ? 0 : -1) : 1;
        }
        OffsetDateTime timeA = Timestamps.parseOrNull(a);
        OffsetDateTime timeB = Timestamps.parseOrNull(b);
        if (timeA != null && timeB != null) {
            return timeA.compareTo(timeB);
        }
        if (a instanceof Comparable && a.getClass().isInstance(b)) {
            return ((Comparable) a).compareTo(b);
        }
        return a.toString().compareTo(b.toString());
    }

    private static Map<String, Object> copy(Map<String, Object> row) {
        return row != null ? new LinkedHashMap<>(row) : null;
    }
}
