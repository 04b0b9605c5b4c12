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
/**
 * Durable storage for the appointment store.
 * <p>
 * The whole record set is one versioned JSON snapshot, replaced atomically:
 * <ul>
 *   <li>{@link dev.mars.clinicstore.storage.SnapshotStorage} - The storage interface</li>
 *   <li>{@link dev.mars.clinicstore.storage.FileSnapshotStorage} - File-based implementation with backups</li>
 *   <li>{@link dev.mars.clinicstore.storage.StoreConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Atomic replace:</b> A reader sees either the old or the new snapshot, never a mix</li>
 *   <li><b>Crash safety:</b> A crash mid-save leaves the previous primary intact</li>
 *   <li><b>Recovery:</b> A corrupt primary is replaced by the newest valid backup</li>
 * </ul>
 *
 * @see dev.mars.clinicstore.storage.SnapshotStorage
 */
package dev.mars.clinicstore.storage;
