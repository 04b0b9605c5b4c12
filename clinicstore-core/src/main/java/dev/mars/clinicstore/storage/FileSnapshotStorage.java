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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File-based implementation of {@link SnapshotStorage}.
 * <p>
 * <b>Files:</b>
 * <pre>
 * data/
 *  ├─ appointments.json        // primary snapshot (atomic replace)
 *  ├─ appointments.json.tmp    // in-flight write, never read
 *  ├─ store.lock               // exclusive process lock
 *  ├─ backups/
 *  │   ├─ appointments-r0000000007-20261019T091500123.json
 *  │   └─ appointments-r0000000006-20261019T091000045.json
 *  └─ quarantine/              // files moved aside by operator recovery
 * </pre>
 * Backup names carry a rotation counter (ordering) and the UTC time of the
 * rotation.
 * <p>
 * <b>Thread Safety:</b>
 * All file operations are serialized through a single-threaded executor.
 * Two saves can never interleave their temp file, rotation and rename steps.
 * <p>
 * <b>Durability:</b>
 * <ul>
 *   <li>write temp → fsync temp → copy primary into backups → rename temp over primary → fsync dir</li>
 *   <li>The rename is the only step that touches the primary, and it only runs
 *       after the temp file is complete and durable.</li>
 * </ul>
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>File Locking:</b> Exclusive lock on {@code store.lock} prevents two processes
 *       from sharing a data directory.</li>
 *   <li><b>Disk Space Checking:</b> Pre-flight check before every save.</li>
 *   <li><b>Read-After-Write Verification:</b> Optional decode of the temp file
 *       before it is allowed to replace the primary.</li>
 *   <li><b>Integrity:</b> CRC32C checksum over the record set, validated on load.</li>
 * </ul>
 *
 * @see SnapshotStorage
 */
public final class FileSnapshotStorage implements SnapshotStorage {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileSnapshotStorage.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Primary snapshot file name */
    static final String SNAPSHOT_FILE = "appointments.json";

    /** Temp file name for in-flight saves */
    static final String SNAPSHOT_TMP_FILE = SNAPSHOT_FILE + ".tmp";

    /** Lock file name */
    static final String LOCK_FILE = "store.lock";

    /** Backup directory name */
    static final String BACKUP_DIR = "backups";

    /** Quarantine directory name */
    static final String QUARANTINE_DIR = "quarantine";

    private static final Pattern BACKUP_NAME = Pattern.compile("appointments-r(\\d{10})-(\\d{8}T\\d{9})\\.json");

    private static final DateTimeFormatter BACKUP_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS").withZone(ZoneOffset.UTC);

    // ========================================================================
    // State
    // ========================================================================

    /**
     * Single-threaded executor for all file operations.
     * <p>
     * <b>INVARIANT:</b> every read and write of the data directory runs on
     * this executor. <b>DO NOT</b> increase the pool size.
     */
    private final ExecutorService ioExecutor;
    private final StoreConfig config;
    private final SnapshotCodec codec;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int backupRetention;
    private final long minFreeSpace;

    private Path dataDir;
    private Path backupDir;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Creates a new FileSnapshotStorage with the specified configuration.
     *
     * @param config the store configuration
     */
    public FileSnapshotStorage(StoreConfig config) {
        this.config = config;
        this.codec = new SnapshotCodec();
        this.syncEnabled = config.syncEnabled();
        this.verifyWrites = config.verifyWrites();
        this.backupRetention = config.backupRetention();
        this.minFreeSpace = config.minFreeSpaceBytes();

        this.ioExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "snapshot-io");
            t.setDaemon(true);
            return t;
        });

        LOG.info("FileSnapshotStorage initialized: syncEnabled={}, verifyWrites={}, backupRetention={}, minFreeSpace={} MB",
                syncEnabled, verifyWrites, backupRetention, minFreeSpace / 1024 / 1024);

        if (!syncEnabled) {
            LOG.warn("FileSnapshotStorage created with fsync DISABLED. Do NOT use in production!");
        }
    }

    // ========================================================================
    // Open / Close
    // ========================================================================

    /**
     * Opens the storage using the data directory from the configuration.
     *
     * @return a future that completes when storage is ready
     */
    public CompletableFuture<Void> open() {
        return open(config.dataDir());
    }

    @Override
    public CompletableFuture<Void> open(Path dataDir) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Storage is closed"));
        }
        return CompletableFuture.runAsync(() -> {
            try {
                LOG.info("Opening snapshot storage at: {}", dataDir);
                this.dataDir = dataDir;
                this.backupDir = dataDir.resolve(BACKUP_DIR);
                Files.createDirectories(backupDir);

                acquireExclusiveLock();
                checkDiskSpace();

                // A temp file left behind by a crash was never renamed, so it is not part of any snapshot
                Path staleTmp = dataDir.resolve(SNAPSHOT_TMP_FILE);
                if (Files.deleteIfExists(staleTmp)) {
                    LOG.warn("Removed stale temp file from an interrupted save: {}", staleTmp);
                }
                LOG.info("Snapshot storage opened: dir={}, backups={}", dataDir, listBackupFiles().size());

            } catch (IOException e) {
                LOG.error("Failed to open snapshot storage at {}: {}", dataDir, e.getMessage(), e);
                releaseExclusiveLock();
                throw new StorageException("Failed to open snapshot storage at " + dataDir, e);
            } catch (StorageException e) {
                LOG.error("Failed to open snapshot storage at {}: {}", dataDir, e.getMessage());
                releaseExclusiveLock();
                throw e;
            }
        }, ioExecutor);
    }

    @Override
    public void close() {
        if (closed) {
            LOG.debug("Storage already closed, ignoring duplicate close()");
            return;
        }
        closed = true;
        LOG.info("Closing snapshot storage at: {}", dataDir);

        ioExecutor.execute(this::releaseExclusiveLock);
        ioExecutor.shutdown();

        // Lock released before close() returns
        try {
            if (!ioExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Snapshot I/O did not finish within 10 s of close()");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for snapshot I/O to finish");
        }
        LOG.info("Snapshot storage closed");
    }

    // ========================================================================
    // Load
    // ========================================================================

    @Override
    public CompletableFuture<StoreSnapshot> load() {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Storage is closed"));
        }
        return CompletableFuture.supplyAsync(() -> {
            Path primary = dataDir.resolve(SNAPSHOT_FILE);
            List<Path> backups;
            try {
                backups = listBackupFiles();
            } catch (IOException e) {
                LOG.error("Failed to list backups in {}: {}", backupDir, e.getMessage(), e);
                throw new StorageException("Failed to list backups in " + backupDir, e);
            }

            if (!Files.exists(primary) && backups.isEmpty()) {
                LOG.info("No snapshot found in {}, starting with an empty store", dataDir);
                return StoreSnapshot.empty();
            }

            try {
                StoreSnapshot snapshot = readSnapshot(primary);
                LOG.info("Snapshot loaded: generation={}, appointments={}, writtenAt={}",
                        snapshot.generation(), snapshot.size(), snapshot.writtenAt());
                return snapshot;
            } catch (CorruptStoreException e) {
                LOG.warn("Primary snapshot unusable, trying {} backup(s): {}", backups.size(), e.getMessage());
                return recoverFromBackups(primary, backups, e);
            }
        }, ioExecutor);
    }

    private StoreSnapshot recoverFromBackups(Path primary, List<Path> backups, CorruptStoreException primaryFailure) {
        UnrecoverableStoreException failure = new UnrecoverableStoreException(
                "Primary snapshot and all " + backups.size() + " backup(s) in " + dataDir + " are unusable");
        failure.addSuppressed(primaryFailure);

        for (Path backup : backups) {
            StoreSnapshot snapshot;
            try {
                snapshot = readSnapshot(backup);
            } catch (CorruptStoreException e) {
                LOG.warn("Backup {} unusable: {}", backup.getFileName(), e.getMessage());
                failure.addSuppressed(e);
                continue;
            }

            try {
                restorePrimary(primary, backup);
            } catch (IOException e) {
                // The content is valid; the next successful save rewrites the primary
                LOG.error("Recovered from {} but could not restore it as the primary snapshot: {}",
                        backup.getFileName(), e.getMessage(), e);
            }
            LOG.warn("Recovered snapshot generation {} ({} appointments) from backup {}",
                    snapshot.generation(), snapshot.size(), backup.getFileName());
            return snapshot;
        }

        LOG.error("Unrecoverable store at {}: primary and {} backup(s) failed validation", dataDir, backups.size());
        throw failure;
    }

    private StoreSnapshot readSnapshot(Path file) {
        if (!Files.exists(file)) {
            throw new CorruptStoreException(file, "file is missing");
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new CorruptStoreException(file, "unreadable (" + e.getMessage() + ")", e);
        }
        LOG.debug("Read {} bytes from {}", bytes.length, file);
        return codec.decode(bytes, file);
    }

    /**
     * Moves a corrupt primary aside and puts a copy of the backup in its place,
     * using the same temp + rename sequence as a normal save.
     */
    private void restorePrimary(Path primary, Path backup) throws IOException {
        if (Files.exists(primary)) {
            Path aside = dataDir.resolve(SNAPSHOT_FILE + ".corrupt-" + System.currentTimeMillis());
            Files.move(primary, aside, StandardCopyOption.ATOMIC_MOVE);
            LOG.warn("Moved corrupt primary snapshot aside: {}", aside.getFileName());
        }
        Path tmp = dataDir.resolve(SNAPSHOT_TMP_FILE);
        Files.copy(backup, tmp, StandardCopyOption.REPLACE_EXISTING);
        forceFile(tmp);
        Files.move(tmp, primary, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        if (syncEnabled) {
            syncDirectory(dataDir);
        }
        LOG.info("Primary snapshot restored from backup {}", backup.getFileName());
    }

    // ========================================================================
    // Save
    // ========================================================================

    @Override
    public CompletableFuture<Void> saveAtomic(StoreSnapshot snapshot) {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Storage is closed"));
        }
        LOG.debug("Saving snapshot generation {} ({} appointments)", snapshot.generation(), snapshot.size());

        return CompletableFuture.runAsync(() -> {
            Path primary = dataDir.resolve(SNAPSHOT_FILE);
            Path tmp = dataDir.resolve(SNAPSHOT_TMP_FILE);
            long startNanos = System.nanoTime();
            int size;
            try {
                checkDiskSpace();

                byte[] bytes = codec.encode(snapshot);
                size = bytes.length;
                writeFully(tmp, bytes);

                if (verifyWrites) {
                    verifyWrittenSnapshot(tmp, snapshot);
                }

                rotatePrimaryIntoBackups(primary);

                // Commit point: the only step that touches the primary
                Files.move(tmp, primary, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                LOG.trace("Atomic rename: {} -> {}", tmp, primary);

                if (syncEnabled) {
                    syncDirectory(dataDir);
                }
            } catch (StoreWriteException e) {
                deleteTempFile(tmp);
                throw e;
            } catch (IOException | StorageException e) {
                LOG.error("Failed to save snapshot generation {}: {}", snapshot.generation(), e.getMessage(), e);
                deleteTempFile(tmp);
                throw new StoreWriteException(
                        "Failed to save snapshot generation " + snapshot.generation() + " to " + primary, e);
            }

            pruneBackups();

            long elapsedMicros = (System.nanoTime() - startNanos) / 1000;
            LOG.info("Snapshot saved: generation={}, appointments={}, {} bytes, {} us",
                    snapshot.generation(), snapshot.size(), size, elapsedMicros);
        }, ioExecutor);
    }

    private void writeFully(Path file, byte[] bytes) throws IOException {
        try (FileChannel ch = FileChannel.open(file,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            if (syncEnabled) {
                ch.force(true);
                LOG.trace("Synced {}", file);
            }
        }
    }

    /**
     * Copies the current primary into the backup directory before it is replaced.
     * The copy goes through its own temp name so a half-copied backup is never
     * picked up by recovery.
     */
    private void rotatePrimaryIntoBackups(Path primary) throws IOException {
        if (backupRetention == 0 || !Files.exists(primary)) {
            return;
        }
        long rotation = nextRotationNumber();
        String name = String.format("appointments-r%010d-%s.json",
                rotation, BACKUP_TIMESTAMP.format(Instant.now()));
        Path backup = backupDir.resolve(name);
        Path backupTmp = backupDir.resolve(name + ".tmp");
        try {
            Files.copy(primary, backupTmp, StandardCopyOption.REPLACE_EXISTING);
            forceFile(backupTmp);
            Files.move(backupTmp, backup, StandardCopyOption.ATOMIC_MOVE);
            LOG.debug("Rotated primary snapshot into backup {}", name);
        } finally {
            deleteTempFile(backupTmp);
        }
    }

    private void pruneBackups() {
        try {
            List<Path> backups = listBackupFiles();
            for (int i = backupRetention; i < backups.size(); i++) {
                Files.deleteIfExists(backups.get(i));
                LOG.debug("Pruned backup {}", backups.get(i).getFileName());
            }
        } catch (IOException e) {
            // The new snapshot is already committed; extra backups are only wasted space
            LOG.warn("Could not prune backups in {}: {}", backupDir, e.getMessage());
        }
    }

    /**
     * Reads the temp file back and decodes it before it may replace the primary.
     * <p>
     * This detects silent filesystem corruption where writes appear to succeed
     * but data is not correctly persisted.
     */
    private void verifyWrittenSnapshot(Path tmp, StoreSnapshot expected) throws IOException {
        StoreSnapshot readBack;
        try {
            readBack = codec.decode(Files.readAllBytes(tmp), tmp);
        } catch (CorruptStoreException e) {
            LOG.error("Write verification failed for generation {}: {}", expected.generation(), e.getMessage());
            throw new StoreWriteException("Write verification failed: " + e.getMessage(), e);
        }
        if (readBack.generation() != expected.generation()
                || !readBack.appointments().equals(expected.appointments())) {
            LOG.error("Write verification mismatch for generation {}", expected.generation());
            throw new StoreWriteException(
                    "Write verification failed: read-back snapshot differs from generation " + expected.generation());
        }
        LOG.trace("Write verification passed for generation {}", expected.generation());
    }

    // ========================================================================
    // Backups / Quarantine
    // ========================================================================

    @Override
    public CompletableFuture<List<Path>> listBackups() {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Storage is closed"));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                return listBackupFiles();
            } catch (IOException e) {
                LOG.error("Failed to list backups in {}: {}", backupDir, e.getMessage(), e);
                throw new StorageException("Failed to list backups in " + backupDir, e);
            }
        }, ioExecutor);
    }

    @Override
    public CompletableFuture<Path> quarantine() {
        if (closed) {
            return CompletableFuture.failedFuture(new StorageException("Storage is closed"));
        }
        return CompletableFuture.supplyAsync(() -> {
            Path target = dataDir.resolve(QUARANTINE_DIR).resolve(Long.toString(System.currentTimeMillis()));
            try {
                Files.createDirectories(target);
                int moved = 0;
                Path primary = dataDir.resolve(SNAPSHOT_FILE);
                if (Files.exists(primary)) {
                    Files.move(primary, target.resolve(SNAPSHOT_FILE));
                    moved++;
                }
                for (Path backup : listBackupFiles()) {
                    Files.move(backup, target.resolve(backup.getFileName()));
                    moved++;
                }
                if (syncEnabled) {
                    syncDirectory(dataDir);
                }
                LOG.warn("Quarantined {} snapshot file(s) into {}", moved, target);
                return target;
            } catch (IOException e) {
                LOG.error("Failed to quarantine snapshot files into {}: {}", target, e.getMessage(), e);
                throw new StorageException("Failed to quarantine snapshot files into " + target, e);
            }
        }, ioExecutor);
    }

    /**
     * Backups sorted newest first (highest rotation number first).
     */
    private List<Path> listBackupFiles() throws IOException {
        List<Path> backups = new ArrayList<>();
        if (!Files.isDirectory(backupDir)) {
            return backups;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(backupDir)) {
            for (Path p : stream) {
                if (BACKUP_NAME.matcher(p.getFileName().toString()).matches()) {
                    backups.add(p);
                }
            }
        }
        backups.sort(Comparator.comparingLong(FileSnapshotStorage::rotationNumber).reversed());
        return backups;
    }

    private long nextRotationNumber() throws IOException {
        List<Path> backups = listBackupFiles();
        return backups.isEmpty() ? 1L : rotationNumber(backups.get(0)) + 1;
    }

    private static long rotationNumber(Path backup) {
        Matcher m = BACKUP_NAME.matcher(backup.getFileName().toString());
        return m.matches() ? Long.parseLong(m.group(1)) : -1L;
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    private void forceFile(Path file) throws IOException {
        if (!syncEnabled) {
            return;
        }
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            ch.force(true);
        }
    }

    private void deleteTempFile(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.warn("Could not delete temp file {}: {}", tmp, e.getMessage());
        }
    }

    /** Makes the last rename in {@code dir} durable. Not every file system allows it. */
    private void syncDirectory(Path dir) {
        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
        } catch (IOException e) {
            LOG.debug("Directory fsync unavailable for {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Takes {@value #LOCK_FILE} so that only one store, in this process or
     * another, writes the data directory.
     *
     * @throws StorageException if another store holds the directory
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = dataDir.resolve(LOCK_FILE);
        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        FileLock lock;
        try {
            lock = lockChannel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        }
        if (lock == null) {
            lockChannel.close();
            throw new StorageException("Appointment store at " + dataDir + " is already open elsewhere");
        }
        exclusiveLock = lock;
        LOG.info("Store lock acquired: {}", lockPath);
    }

    private void releaseExclusiveLock() {
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
            }
            if (lockChannel != null && lockChannel.isOpen()) {
                lockChannel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not release store lock in {}: {}", dataDir, e.getMessage());
        }
    }

    private void checkDiskSpace() throws IOException {
        long usable = Files.getFileStore(dataDir).getUsableSpace();
        if (usable < minFreeSpace) {
            throw new StorageException("Only " + usable / (1024 * 1024) + " MB free in " + dataDir
                    + ", need " + minFreeSpace / (1024 * 1024) + " MB");
        }
    }
}
