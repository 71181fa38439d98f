package io.github.reugn.route4j.processor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Handler entries collected during one compilation, keyed by scope.
 *
 * <p>Writers are mutually exclusive with each other and with readers; readers may run
 * concurrently. Snapshots are immutable copies, so no reader ever observes a partial insert.
 *
 * <p>Locks are acquired with a bounded wait. If a lock cannot be obtained within the
 * configured timeout, or the waiting thread is interrupted, the operation fails with
 * {@link ErrorKind#LOCK_ACQUISITION_FAILURE}.
 */
final class Registry {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<RegistrationEntry>> entries = new LinkedHashMap<>();
    private final Duration lockTimeout;

    Registry(Duration lockTimeout) {
        this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
    }

    /**
     * Appends an entry to the sequence of the given scope, creating the sequence if absent.
     *
     * @param scope the filing key
     * @param entry the entry to append
     * @throws RegistrationException if the write lock cannot be acquired
     */
    void insert(String scope, RegistrationEntry entry) {
        Objects.requireNonNull(scope, "scope");
        Objects.requireNonNull(entry, "entry");
        Lock writeLock = acquire(lock.writeLock(), "write");
        try {
            entries.computeIfAbsent(scope, k -> new ArrayList<>()).add(entry);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns a copy of the entries filed under the given scope.
     *
     * @param scope the filing key
     * @return the entries in insertion order; empty if none were filed
     */
    List<RegistrationEntry> snapshotFor(String scope) {
        return read(() -> List.copyOf(entries.getOrDefault(scope, List.of())));
    }

    /**
     * Returns a copy of the whole registry.
     *
     * @return scopes in first-insertion order, each with its entries in insertion order
     */
    Map<String, List<RegistrationEntry>> snapshotAll() {
        return read(() -> {
            Map<String, List<RegistrationEntry>> copy = new LinkedHashMap<>();
            entries.forEach((scope, list) -> copy.put(scope, List.copyOf(list)));
            return Collections.unmodifiableMap(copy);
        });
    }

    /**
     * Returns the total number of entries across all scopes.
     */
    int size() {
        return read(() -> entries.values().stream().mapToInt(List::size).sum());
    }

    /**
     * Runs {@code action} while holding the read lock.
     */
    <T> T read(Supplier<T> action) {
        Lock readLock = acquire(lock.readLock(), "read");
        try {
            return action.get();
        } finally {
            readLock.unlock();
        }
    }

    private Lock acquire(Lock target, String mode) {
        try {
            if (!target.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new RegistrationException(ErrorKind.LOCK_ACQUISITION_FAILURE,
                        "Failed to acquire the registry " + mode + " lock within " +
                                lockTimeout.toMillis() + " ms");
            }
            return target;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegistrationException(ErrorKind.LOCK_ACQUISITION_FAILURE,
                    "Interrupted while acquiring the registry " + mode + " lock", e);
        }
    }
}
