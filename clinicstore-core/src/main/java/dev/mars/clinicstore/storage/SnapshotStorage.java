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
package dev.mars.clinicstore.storage;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Durable storage for the appointment snapshot.
 * <p>
 * The store facade depends solely on this interface, not on the file-based
 * implementation.
 * <p>
 * <b>Critical Contract:</b> {@link #saveAtomic(StoreSnapshot)} must ensure the
 * new snapshot is durable (fsync) before the returned Future completes
 * successfully, and must never leave a partially written primary snapshot.
 *
 * @see FileSnapshotStorage
 */
public interface SnapshotStorage extends Closeable {

    /**
     * Opens the storage engine.
     *
     * @param dataDir the directory holding the snapshot and its backups
     * @return a Future that completes when storage is ready
     */
    CompletableFuture<Void> open(Path dataDir);

    /**
     * Loads the current snapshot on startup.
     * <p>
     * A missing or corrupt primary snapshot is recovered from the newest
     * usable backup. Completes exceptionally with
     * {@link UnrecoverableStoreException} when nothing usable is left.
     *
     * @return the persisted snapshot, or {@link StoreSnapshot#empty()} for a fresh directory
     */
    CompletableFuture<StoreSnapshot> load();

    /**
     * Atomically replaces the primary snapshot, rotating the previous one into
     * the backup set.
     * <p>
     * Completes exceptionally with {@link StoreWriteException} on any I/O
     * failure, in which case the primary snapshot is unchanged.
     *
     * @param snapshot the complete state to persist
     * @return a Future that completes when the snapshot is durable
     */
    CompletableFuture<Void> saveAtomic(StoreSnapshot snapshot);

    /**
     * Lists rotated backups.
     *
     * @return backup files, newest first
     */
    CompletableFuture<List<Path>> listBackups();

    /**
     * Moves the primary snapshot and all backups out of the way so that a new,
     * empty store can be started after an unrecoverable load.
     *
     * @return the directory the files were moved to
     */
    CompletableFuture<Path> quarantine();

    /**
     * Closes the storage, releasing all resources.
     * <p>
     * After close, no other methods should be called.
     */
    @Override
    void close();
}
