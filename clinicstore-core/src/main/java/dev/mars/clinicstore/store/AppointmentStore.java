/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.clinicstore.store;

import dev.mars.clinicstore.cache.TtlLruCache;
import dev.mars.clinicstore.concurrency.LockCoordinator;
import dev.mars.clinicstore.model.Appointment;
import dev.mars.clinicstore.model.AppointmentChanges;
import dev.mars.clinicstore.model.AppointmentDraft;
import dev.mars.clinicstore.model.AppointmentFilter;
import dev.mars.clinicstore.model.AppointmentStatus;
import dev.mars.clinicstore.model.InvalidTransitionException;
import dev.mars.clinicstore.storage.FileSnapshotStorage;
import dev.mars.clinicstore.storage.SnapshotStorage;
import dev.mars.clinicstore.storage.StorageException;
import dev.mars.clinicstore.storage.StoreConfig;
import dev.mars.clinicstore.storage.StoreSnapshot;
import dev.mars.clinicstore.storage.StoreWriteException;
import dev.mars.clinicstore.storage.UnrecoverableStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Concurrent appointment store: in-memory records, a read cache, and durable
 * snapshots.
 * <p>
 * <b>Lifecycle:</b> constructed and owned by the caller. {@link #open()} loads
 * the last snapshot; {@link #close()} saves a final snapshot and releases the
 * data directory.
 *
 * <h2>Write path</h2>
 * Every write runs inside {@link LockCoordinator#write}:
 * <ol>
 *   <li>validate (existence, transition, booking rule)</li>
 *   <li>apply the change to the in-memory records</li>
 *   <li>invalidate the cached entry</li>
 *   <li>save the full snapshot</li>
 * </ol>
 * If the save fails the caller receives {@link StoreWriteException} and the
 * write is not committed to disk. Memory already holds it, so the store is
 * marked dirty and the next successful save ({@link #flush()} or any later
 * write) brings the file back in line.
 *
 * <h2>Degraded mode</h2>
 * When neither the primary snapshot nor any backup can be loaded the store
 * starts empty and refuses writes and flushes with
 * {@link UnrecoverableStoreException} until an operator calls
 * {@link #resumeWithEmptyStore()}. Nothing on disk is overwritten meanwhile.
 *
 * <h2>Example</h2>
 * <pre>
 * try (AppointmentStore store = new AppointmentStore(StoreConfig.load())) {
 *     store.open();
 *     Appointment a = store.create(AppointmentDraft.of("P-1", "DR-7", LocalDateTime.of(2026, 3, 2, 9, 0)));
 *     store.cancel(a.id());
 * }
 * </pre>
 */
public final class AppointmentStore implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AppointmentStore.class);

    private static final String ID_FORMAT = "APT-%06d";

    private final StoreConfig config;
    private final SnapshotStorage storage;
    private final BookingRule bookingRule;
    private final Clock clock;
    private final LockCoordinator coordinator = new LockCoordinator();

    /** Negative lookups are cached as {@code Optional.empty()}. */
    private final TtlLruCache<String, Optional<Appointment>> cache;

    // Guarded by the coordinator: read lock to read, write lock to change.
    private final Map<String, Appointment> records = new HashMap<>();

    private final AtomicLong sequence = new AtomicLong(1);

    // Serializes saves; flushes run under the shared lock and may overlap.
    private final ReentrantLock saveLock = new ReentrantLock();
    private long generation;

    private volatile boolean opened;
    private volatile boolean closed;
    private volatile boolean degraded;
    private volatile boolean dirty;

    public AppointmentStore(StoreConfig config) {
        this(config, new FileSnapshotStorage(config), new SlotConflictRule(), Clock.systemUTC());
    }

    public AppointmentStore(StoreConfig config, SnapshotStorage storage, BookingRule bookingRule, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.storage = Objects.requireNonNull(storage, "storage");
        this.bookingRule = Objects.requireNonNull(bookingRule, "bookingRule");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cache = new TtlLruCache<>(config.cacheCapacity(), config.cacheTtl(), clock);
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    /**
     * Opens the data directory and loads the latest valid snapshot.
     * <p>
     * An unrecoverable store does not fail the open; the store comes up
     * empty and degraded instead.
     *
     * @throws StorageException if the data directory cannot be opened or locked
     */
    public void open() {
        if (closed) {
            throw new StoreClosedException("Store is closed");
        }
        if (opened) {
            LOG.debug("Store already open, ignoring duplicate open()");
            return;
        }
        Path dataDir = config.dataDir();
        await(storage.open(dataDir));

        StoreSnapshot snapshot = loadOrDegrade(dataDir);

        coordinator.exclusive(() -> {
            records.clear();
            records.putAll(snapshot.appointments());
            sequence.set(Math.max(snapshot.nextSequence(), snapshot.highestSequence() + 1));
            generation = snapshot.generation();
            cache.clear();
            return null;
        });
        opened = true;
        LOG.info("Appointment store opened: dir={}, appointments={}, generation={}, degraded={}",
                dataDir, snapshot.size(), snapshot.generation(), degraded);
    }

    private StoreSnapshot loadOrDegrade(Path dataDir) {
        try {
            return await(storage.load());
        } catch (UnrecoverableStoreException e) {
            LOG.error("Store at {} is unrecoverable, starting EMPTY in degraded mode. "
                    + "Writes are refused until resumeWithEmptyStore() is called: {}", dataDir, e.getMessage());
            degraded = true;
            return StoreSnapshot.empty();
        }
    }

    /**
     * Saves a final snapshot unless degraded, then releases the data directory.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (opened && !degraded) {
                coordinator.exclusive(() -> {
                    persist();
                    return null;
                });
            }
        } catch (StorageException e) {
            LOG.error("Final save on close failed, changes since generation {} are lost: {}",
                    generation, e.getMessage(), e);
        } finally {
            storage.close();
            LOG.info("Appointment store closed");
        }
    }

    /**
     * Operator recovery from degraded mode: moves the damaged snapshot files
     * into quarantine and starts over with an empty, writable store.
     *
     * @return the quarantine directory
     * @throws IllegalStateException if the store is not degraded
     */
    public Path resumeWithEmptyStore() {
        ensureOpen();
        return coordinator.exclusive(() -> {
            if (!degraded) {
                throw new IllegalStateException("Store is not degraded");
            }
            Path quarantined = await(storage.quarantine());
            records.clear();
            sequence.set(StoreSnapshot.empty().nextSequence());
            generation = 0;
            cache.clear();
            degraded = false;
            persist();
            LOG.warn("Resumed with an empty store, damaged files quarantined in {}", quarantined);
            return quarantined;
        });
    }

    // ========================================================================
    // Writes
    // ========================================================================

    /**
     * Books a new appointment.
     *
     * @throws BookingConflictException    if the booking rule rejects it
     * @throws UnrecoverableStoreException if the store is degraded
     * @throws StoreWriteException         if the snapshot could not be saved
     */
    public Appointment create(AppointmentDraft draft) {
        Objects.requireNonNull(draft, "draft");
        ensureOpen();
        String id = String.format(ID_FORMAT, sequence.getAndIncrement());
        return coordinator.write(id, () -> {
            ensureWritable();
            if (records.containsKey(id)) {
                throw new IllegalStateException("Identifier " + id + " is already allocated");
            }
            Appointment appointment = Appointment.schedule(id, draft, now());
            bookingRule.check(appointment, records.values());
            records.put(id, appointment);
            cache.invalidate(id);
            persist();
            LOG.debug("Created {} for patient {} with {} at {}",
                    id, draft.patientId(), draft.practitionerId(), draft.scheduledAt());
            return appointment;
        });
    }

    /**
     * Applies {@code changes} to an existing appointment.
     *
     * @throws AppointmentNotFoundException if {@code id} is unknown
     * @throws InvalidTransitionException   if the status change or reschedule is not allowed
     * @throws BookingConflictException     if a reschedule collides with another booking
     */
    public Appointment update(String id, AppointmentChanges changes) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(changes, "changes");
        ensureOpen();
        return coordinator.write(id, () -> {
            ensureWritable();
            Appointment current = require(id);
            Appointment updated = current.apply(changes, now());
            if (!updated.scheduledAt().equals(current.scheduledAt())) {
                bookingRule.check(updated, records.values());
            }
            records.put(id, updated);
            cache.invalidate(id);
            persist();
            LOG.debug("Updated {}: {} -> {}", id, current.status(), updated.status());
            return updated;
        });
    }

    /**
     * Soft-deletes an appointment. Cancelling a cancelled appointment returns it unchanged.
     */
    public Appointment cancel(String id) {
        return transition(id, AppointmentStatus.CANCELLED);
    }

    /**
     * Marks an appointment as attended. Completing a completed appointment returns it unchanged.
     */
    public Appointment complete(String id) {
        return transition(id, AppointmentStatus.COMPLETED);
    }

    private Appointment transition(String id, AppointmentStatus target) {
        Objects.requireNonNull(id, "id");
        ensureOpen();
        return coordinator.write(id, () -> {
            ensureWritable();
            Appointment current = require(id);
            if (current.status() == target) {
                return current;
            }
            Appointment updated = current.apply(AppointmentChanges.status(target), now());
            records.put(id, updated);
            cache.invalidate(id);
            persist();
            LOG.debug("{} -> {}: {}", current.status(), target, id);
            return updated;
        });
    }

    /**
     * Physically removes an appointment. Unlike {@link #cancel} the record is gone.
     */
    public Appointment purge(String id) {
        Objects.requireNonNull(id, "id");
        ensureOpen();
        return coordinator.write(id, () -> {
            ensureWritable();
            Appointment removed = records.remove(id);
            if (removed == null) {
                throw new AppointmentNotFoundException(id);
            }
            cache.invalidate(id);
            persist();
            LOG.info("Purged appointment {}", id);
            return removed;
        });
    }

    // ========================================================================
    // Reads
    // ========================================================================

    /**
     * @throws AppointmentNotFoundException if {@code id} is unknown
     */
    public Appointment get(String id) {
        Objects.requireNonNull(id, "id");
        ensureOpen();
        return coordinator.read(() -> {
            Optional<Optional<Appointment>> cached = cache.get(id);
            Optional<Appointment> found;
            if (cached.isPresent()) {
                found = cached.get();
            } else {
                found = Optional.ofNullable(records.get(id));
                cache.put(id, found);
            }
            return found.orElseThrow(() -> new AppointmentNotFoundException(id));
        });
    }

    /**
     * Appointments matching {@code filter}, ordered by start time then identifier.
     */
    public List<Appointment> list(AppointmentFilter filter) {
        Objects.requireNonNull(filter, "filter");
        ensureOpen();
        return coordinator.read(() -> records.values().stream()
                .filter(filter::matches)
                .sorted(Appointment.BY_SCHEDULE)
                .collect(Collectors.toList()));
    }

    public StoreStatistics statistics() {
        ensureOpen();
        return coordinator.read(() -> {
            Map<AppointmentStatus, Long> byStatus = new EnumMap<>(AppointmentStatus.class);
            for (Appointment appointment : records.values()) {
                byStatus.merge(appointment.status(), 1L, Long::sum);
            }
            return new StoreStatistics(records.size(), byStatus, currentGeneration(), degraded, dirty, cache.stats());
        });
    }

    public boolean isDegraded() {
        return degraded;
    }

    public boolean isDirty() {
        return dirty;
    }

    // ========================================================================
    // Maintenance
    // ========================================================================

    /**
     * Saves the current records whether or not anything changed.
     *
     * @throws UnrecoverableStoreException if the store is degraded
     * @throws StoreWriteException         if the snapshot could not be saved
     */
    public void flush() {
        ensureOpen();
        coordinator.read(() -> {
            ensureWritable();
            persist();
            return null;
        });
    }

    /**
     * Removes expired cache entries.
     *
     * @return number of entries removed
     */
    public int sweepCache() {
        ensureOpen();
        return coordinator.read(cache::sweep);
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    // Caller holds the coordinator's read or write lock.
    private void persist() {
        saveLock.lock();
        try {
            StoreSnapshot snapshot = new StoreSnapshot(StoreSnapshot.CURRENT_FORMAT_VERSION,
                    generation + 1, now(), sequence.get(), records);
            try {
                await(storage.saveAtomic(snapshot));
            } catch (StorageException e) {
                dirty = true;
                LOG.error("Snapshot save failed, in-memory state is ahead of disk until the next save: {}",
                        e.getMessage());
                throw e;
            }
            generation = snapshot.generation();
            if (dirty) {
                LOG.info("Snapshot generation {} saved, store is clean again", generation);
            }
            dirty = false;
        } finally {
            saveLock.unlock();
        }
    }

    private long currentGeneration() {
        saveLock.lock();
        try {
            return generation;
        } finally {
            saveLock.unlock();
        }
    }

    private Appointment require(String id) {
        Appointment appointment = records.get(id);
        if (appointment == null) {
            throw new AppointmentNotFoundException(id);
        }
        return appointment;
    }

    private void ensureOpen() {
        if (closed) {
            throw new StoreClosedException("Store is closed");
        }
        if (!opened) {
            throw new StoreClosedException("Store is not open");
        }
    }

    private void ensureWritable() {
        if (degraded) {
            throw new UnrecoverableStoreException(
                    "Store is degraded after an unrecoverable load; call resumeWithEmptyStore() first");
        }
    }

    private Instant now() {
        return clock.instant();
    }

    /**
     * Waits for a storage future, rethrowing its failure as thrown by the storage thread.
     */
    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new StorageException("Storage operation failed", cause);
        }
    }
}
