package com.heronix.autograder.service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of one committed value, replaced whole.
 *
 * Writers take a sequence number before they start fetching and commit with
 * it when done. A commit carrying a sequence older than the committed one is
 * discarded (last-commit-wins), so a slow, superseded refresh never
 * overwrites a newer result. Readers always see a complete value.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
public final class SequencedState<T> {

    private final AtomicLong issued = new AtomicLong();
    private final AtomicReference<Snapshot<T>> committed = new AtomicReference<>();

    public record Snapshot<T>(long sequence, T value) {
    }

    /**
     * Reserve the sequence number for a new fetch or update.
     */
    public long nextSequence() {
        return issued.incrementAndGet();
    }

    /**
     * Commit a value produced under {@code sequence}.
     *
     * @return true if committed, false if a newer value was already committed
     */
    public boolean commit(long sequence, T value) {
        Snapshot<T> next = new Snapshot<>(sequence, value);
        while (true) {
            Snapshot<T> current = committed.get();
            if (current != null && current.sequence() >= sequence) {
                return false;
            }
            if (committed.compareAndSet(current, next)) {
                return true;
            }
        }
    }

    public Optional<T> current() {
        Snapshot<T> snapshot = committed.get();
        return snapshot != null ? Optional.of(snapshot.value()) : Optional.empty();
    }

    public Optional<Snapshot<T>> currentSnapshot() {
        return Optional.ofNullable(committed.get());
    }
}
