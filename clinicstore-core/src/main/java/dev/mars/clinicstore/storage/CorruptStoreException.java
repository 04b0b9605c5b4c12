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

import java.nio.file.Path;

/**
 * A snapshot file is missing, truncated, malformed or fails its checksum.
 * <p>
 * Raised per file. {@link FileSnapshotStorage#load()} handles it locally by
 * falling back to the newest usable backup.
 */
public class CorruptStoreException extends StorageException {

    private final Path file;

    public CorruptStoreException(Path file, String reason) {
        super("Corrupt snapshot " + file + ": " + reason);
        this.file = file;
    }

    public CorruptStoreException(Path file, String reason, Throwable cause) {
        super("Corrupt snapshot " + file + ": " + reason, cause);
        this.file = file;
    }

    /** The file that failed validation. */
    public Path file() {
        return file;
    }
}
