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
package dev.mars.clinicstore.concurrency;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Coordinates readers and writers of the in-memory record set.
 * <p>
 * <b>Locks:</b>
 * <ul>
 *   <li>One fair readers-writer lock guards the whole record set. Reads share
 *       it; a write holds it exclusively.</li>
 *   <li>One lock per record identifier serializes writes to the same record.
 *       It is always taken <i>before</i> the readers-writer lock.</li>
 * </ul>
 * <p>
 * <b>Fairness:</b> a writer that starts waiting is granted the lock once the
 * readers already inside have left. Readers arriving after it queue behind it,
 * so a steady stream of reads cannot starve a write.
 * <p>
 * <b>Cancellation:</b> every wait is interruptible. An interrupted caller gets
 * {@link OperationAbandonedException} and its action never runs. Once an
 * action has started it runs to completion.
 */
public final class LockCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(LockCoordinator.class);

    private final ReentrantReadWriteLock recordSetLock = new ReentrantReadWriteLock(true);
    private final ConcurrentHashMap<String, IdLock> idLocks = new ConcurrentHashMap<>();

    /**
     * Runs {@code action} with shared access to the record set.
     *
     * @throws OperationAbandonedException if interrupted while waiting
     */
    public <T> T read(Supplier<T> action) {
        Lock lock = recordSetLock.readLock();
        acquire(lock, "read");
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs {@code action} holding the lock for {@code id} and exclusive access
     * to the record set.
     *
     * @throws OperationAbandonedException if interrupted while waiting
     */
    public <T> T write(String id, Supplier<T> action) {
        Objects.requireNonNull(id, "id");
        IdLock idLock = retain(id);
        try {
            acquire(idLock.lock, "write " + id);
            try {
                Lock lock = recordSetLock.writeLock();
                acquire(lock, "write " + id);
                try {
                    return action.get();
                } finally {
                    lock.unlock();
                }
            } finally {
                idLock.lock.unlock();
            }
        } finally {
            release(id);
        }
    }

    /**
     * Runs {@code action} with exclusive access to the record set, not tied to
     * any one identifier.
     *
     * @throws OperationAbandonedException if interrupted while waiting
     */
    public <T> T exclusive(Supplier<T> action) {
        Lock lock = recordSetLock.writeLock();
        acquire(lock, "exclusive");
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of identifiers that currently have a lock object, held or awaited.
     */
    public int activeIdLocks() {
        return idLocks.size();
    }

    /**
     * Estimated number of threads waiting for the record set lock.
     */
    public int queueLength() {
        return recordSetLock.getQueueLength();
    }

    private void acquire(Lock lock, String operation) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("Interrupted while waiting for lock: {}", operation);
            throw new OperationAbandonedException("Interrupted while waiting to " + operation, e);
        }
    }

    private IdLock retain(String id) {
        return idLocks.compute(id, (key, existing) -> {
            IdLock idLock = existing == null ? new IdLock() : existing;
            idLock.users++;
            return idLock;
        });
    }

    private void release(String id) {
        idLocks.computeIfPresent(id, (key, idLock) -> --idLock.users == 0 ? null : idLock);
    }

    /** Reference counted; the count is only touched inside the map's compute functions. */
    private static final class IdLock {
        final ReentrantLock lock = new ReentrantLock();
        int users;
    }
}
