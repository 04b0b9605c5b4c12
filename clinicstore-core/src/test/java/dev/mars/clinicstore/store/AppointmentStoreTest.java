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

import dev.mars.clinicstore.MutableClock;
import dev.mars.clinicstore.model.Appointment;
import dev.mars.clinicstore.model.AppointmentChanges;
import dev.mars.clinicstore.model.AppointmentDraft;
import dev.mars.clinicstore.model.AppointmentFilter;
import dev.mars.clinicstore.model.AppointmentStatus;
import dev.mars.clinicstore.model.InvalidTransitionException;
import dev.mars.clinicstore.storage.FileSnapshotStorage;
import dev.mars.clinicstore.storage.SnapshotStorage;
import dev.mars.clinicstore.storage.StoreConfig;
import dev.mars.clinicstore.storage.StoreSnapshot;
import dev.mars.clinicstore.storage.StoreWriteException;
import dev.mars.clinicstore.storage.UnrecoverableStoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link AppointmentStore}.
 * <p>
 * These tests verify:
 * <ul>
 *   <li>CRUD operations and status transitions</li>
 *   <li>Booking conflicts, including racing creators</li>
 *   <li>Reload after restart</li>
 *   <li>Cache coherence after writes</li>
 *   <li>Degraded mode and write failures</li>
 * </ul>
 */
class AppointmentStoreTest {

    private static final LocalDateTime NINE = LocalDateTime.of(2026, 11, 2, 9, 0);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private StoreConfig config;
    private AppointmentStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-10-19T08:00:00Z"));
        config = StoreConfig.builder()
                .dataDir(tempDir)
                .cacheCapacity(8)
                .cacheTtl(Duration.ofSeconds(60))
                .syncEnabled(false)
                .minFreeSpaceMb(0)
                .build();
        store = newStore(new FileSnapshotStorage(config));
        store.open();
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private AppointmentStore newStore(SnapshotStorage storage) {
        return new AppointmentStore(config, storage, new SlotConflictRule(), clock);
    }

    private void restart() {
        store.close();
        store = newStore(new FileSnapshotStorage(config));
        store.open();
    }

    private Appointment book(String patient, String practitioner, LocalDateTime at) {
        return store.create(AppointmentDraft.of(patient, practitioner, at));
    }

    // ========================================================================
    // Create / Get
    // ========================================================================

    @Nested
    @DisplayName("Create and get")
    class CreateAndGetTests {

        @Test
        void testCreateThenGet_ReturnsEqualRecord() {
            Appointment created = store.create(new AppointmentDraft("PAT-1", "DR-1", NINE, "first visit"));

            assertEquals("APT-000001", created.id());
            assertEquals(AppointmentStatus.SCHEDULED, created.status());
            assertEquals(created, store.get(created.id()));
            assertEquals(created, store.get(created.id()));
            assertEquals(1, store.statistics().cache().hits());
        }

        @Test
        void testGetUnknown_NotFound() {
            AppointmentNotFoundException e = assertThrows(AppointmentNotFoundException.class,
                    () -> store.get("APT-999999"));
            assertEquals("APT-999999", e.appointmentId());

            // negative entry served from cache
            assertThrows(AppointmentNotFoundException.class, () -> store.get("APT-999999"));
            assertEquals(1, store.statistics().cache().hits());
        }

        @Test
        void testIdsAreSequential() {
            assertEquals("APT-000001", book("PAT-1", "DR-1", NINE).id());
            assertEquals("APT-000002", book("PAT-2", "DR-1", NINE.plusHours(1)).id());
        }
    }

    // ========================================================================
    // Updates and Transitions
    // ========================================================================

    @Nested
    @DisplayName("Updates and transitions")
    class TransitionTests {

        @Test
        void testUpdate_VisibleThroughCache() {
            Appointment a = book("PAT-1", "DR-1", NINE);
            store.get(a.id());
            clock.advance(Duration.ofMinutes(1));

            Appointment moved = store.update(a.id(),
                    AppointmentChanges.reschedule(NINE.plusHours(2)).withNotes("moved"));

            assertEquals(moved, store.get(a.id()));
            assertEquals(NINE.plusHours(2), store.get(a.id()).scheduledAt());
            assertEquals("moved", store.get(a.id()).notes());
            assertTrue(moved.updatedAt().isAfter(moved.createdAt()));
        }

        @Test
        void testCancel_IsIdempotent() {
            Appointment a = book("PAT-1", "DR-1", NINE);

            Appointment cancelled = store.cancel(a.id());
            long generation = store.statistics().generation();
            Appointment again = store.cancel(a.id());

            assertEquals(AppointmentStatus.CANCELLED, cancelled.status());
            assertEquals(cancelled, again);
            assertEquals(generation, store.statistics().generation());
        }

        @Test
        void testCancelCompleted_InvalidTransition() {
            Appointment a = book("PAT-1", "DR-1", NINE);
            store.complete(a.id());

            assertThrows(InvalidTransitionException.class, () -> store.cancel(a.id()));
            assertEquals(AppointmentStatus.COMPLETED, store.get(a.id()).status());
        }

        @Test
        void testRescheduleCancelled_InvalidTransition() {
            Appointment a = book("PAT-1", "DR-1", NINE);
            store.cancel(a.id());

            assertThrows(InvalidTransitionException.class,
                    () -> store.update(a.id(), AppointmentChanges.reschedule(NINE.plusDays(1))));
            assertEquals("late cancel",
                    store.update(a.id(), AppointmentChanges.notes("late cancel")).notes());
        }

        @Test
        void testUnknownId_NotFoundForEveryWrite() {
            assertThrows(AppointmentNotFoundException.class,
                    () -> store.update("APT-000404", AppointmentChanges.notes("x")));
            assertThrows(AppointmentNotFoundException.class, () -> store.cancel("APT-000404"));
            assertThrows(AppointmentNotFoundException.class, () -> store.complete("APT-000404"));
            assertThrows(AppointmentNotFoundException.class, () -> store.purge("APT-000404"));
        }

        @Test
        void testPurge_RemovesRecord() {
            Appointment a = book("PAT-1", "DR-1", NINE);
            store.get(a.id());

            store.purge(a.id());

            assertThrows(AppointmentNotFoundException.class, () -> store.get(a.id()));
            assertTrue(store.list(AppointmentFilter.all()).isEmpty());
        }
    }

    // ========================================================================
    // Booking Conflicts
    // ========================================================================

    @Nested
    @DisplayName("Booking conflicts")
    class ConflictTests {

        @Test
        void testSameSlot_Rejected() {
            Appointment first = book("PAT-1", "DR-1", NINE);

            BookingConflictException e = assertThrows(BookingConflictException.class,
                    () -> book("PAT-2", "DR-1", NINE));

            assertEquals(first.id(), e.conflictingId());
            assertEquals(1, store.list(AppointmentFilter.all()).size());
        }

        @Test
        void testOtherPractitionerOrCancelled_Allowed() {
            Appointment first = book("PAT-1", "DR-1", NINE);
            assertDoesNotThrow(() -> book("PAT-2", "DR-2", NINE));

            store.cancel(first.id());
            assertDoesNotThrow(() -> book("PAT-3", "DR-1", NINE));
        }

        @Test
        void testRescheduleIntoTakenSlot_Rejected() {
            book("PAT-1", "DR-1", NINE);
            Appointment other = book("PAT-2", "DR-1", NINE.plusHours(1));

            assertThrows(BookingConflictException.class,
                    () -> store.update(other.id(), AppointmentChanges.reschedule(NINE)));
            assertEquals(NINE.plusHours(1), store.get(other.id()).scheduledAt());
        }

        @Test
        void testRacingCreators_ExactlyOneWins() throws Exception {
            int threads = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CyclicBarrier barrier = new CyclicBarrier(threads);
            try {
                List<Future<Boolean>> results = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    String patient = "PAT-" + i;
                    results.add(executor.submit(() -> {
                        barrier.await();
                        try {
                            book(patient, "DR-1", NINE);
                            return true;
                        } catch (BookingConflictException e) {
                            return false;
                        }
                    }));
                }
                int winners = 0;
                for (Future<Boolean> f : results) {
                    if (f.get(10, TimeUnit.SECONDS)) {
                        winners++;
                    }
                }
                assertEquals(1, winners);
            } finally {
                executor.shutdownNow();
            }
            assertEquals(1, store.list(AppointmentFilter.forPractitioner("DR-1")).size());
        }
    }

    // ========================================================================
    // Listing and Statistics
    // ========================================================================

    @Test
    void testList_FilteredAndOrdered() {
        Appointment late = book("PAT-1", "DR-1", NINE.plusHours(3));
        Appointment early = book("PAT-1", "DR-2", NINE);
        book("PAT-2", "DR-1", NINE.plusDays(1));
        store.cancel(early.id());

        List<String> forPatient = store.list(AppointmentFilter.forPatient("PAT-1")).stream()
                .map(Appointment::id).collect(Collectors.toList());
        assertEquals(List.of(early.id(), late.id()), forPatient);

        assertEquals(1, store.list(AppointmentFilter.builder()
                .status(AppointmentStatus.SCHEDULED).date(LocalDate.of(2026, 11, 2)).build()).size());

        StoreStatistics stats = store.statistics();
        assertEquals(3, stats.total());
        assertEquals(2, stats.count(AppointmentStatus.SCHEDULED));
        assertEquals(1, stats.count(AppointmentStatus.CANCELLED));
        assertEquals(0, stats.count(AppointmentStatus.COMPLETED));
        assertFalse(stats.degraded());
    }

    @Test
    void testSweepCache_RemovesExpiredEntries() {
        Appointment a = book("PAT-1", "DR-1", NINE);
        store.get(a.id());
        clock.advance(Duration.ofSeconds(61));

        assertEquals(1, store.sweepCache());
        assertEquals(a, store.get(a.id()));
    }

    // ========================================================================
    // Persistence
    // ========================================================================

    @Nested
    @DisplayName("Persistence")
    class PersistenceTests {

        @Test
        void testRestart_ReloadsRecordsAndSequence() {
            Appointment a = book("PAT-1", "DR-1", NINE);
            Appointment b = book("PAT-2", "DR-1", NINE.plusHours(1));
            store.cancel(b.id());

            restart();

            assertEquals(a, store.get(a.id()));
            assertEquals(AppointmentStatus.CANCELLED, store.get(b.id()).status());
            assertEquals("APT-000003", book("PAT-3", "DR-1", NINE.plusHours(2)).id());
        }

        @Test
        void testConcurrentCreates_AllPersisted() throws Exception {
            int threads = 8;
            int perThread = 10;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CyclicBarrier barrier = new CyclicBarrier(threads);
            Map<String, AppointmentDraft> drafts = new ConcurrentHashMap<>();
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    String practitioner = "DR-" + t;
                    futures.add(executor.submit(() -> {
                        barrier.await();
                        for (int i = 0; i < perThread; i++) {
                            AppointmentDraft draft = AppointmentDraft.of("PAT-" + practitioner + "-" + i,
                                    practitioner, NINE.plusHours(i));
                            assertNull(drafts.put(store.create(draft).id(), draft));
                        }
                        return null;
                    }));
                }
                for (Future<?> f : futures) {
                    f.get(30, TimeUnit.SECONDS);
                }
            } finally {
                executor.shutdownNow();
            }
            assertEquals(threads * perThread, drafts.size());

            restart();

            List<Appointment> listed = store.list(AppointmentFilter.all());
            assertEquals(threads * perThread, listed.size());
            for (Appointment a : listed) {
                AppointmentDraft draft = drafts.get(a.id());
                assertNotNull(draft, "unexpected id " + a.id());
                assertEquals(draft.patientId(), a.patientId());
                assertEquals(draft.practitionerId(), a.practitionerId());
                assertEquals(draft.scheduledAt(), a.scheduledAt());
                assertEquals(AppointmentStatus.SCHEDULED, a.status());
            }
        }

        @Test
        void testEditedSequence_FallsBackToBackupWithoutReusingIds() throws Exception {
            book("PAT-1", "DR-1", NINE);
            book("PAT-2", "DR-1", NINE.plusHours(1));
            store.close();
            Path primary = tempDir.resolve("appointments.json");
            String edited = Files.readString(primary).replaceAll("\"nextSequence\"\\s*:\\s*\\d+", "\"nextSequence\" : 1");
            assertTrue(edited.contains("\"nextSequence\" : 1"));
            Files.writeString(primary, edited);

            store = newStore(new FileSnapshotStorage(config));
            store.open();

            assertFalse(store.isDegraded());
            assertEquals("APT-000003", book("PAT-3", "DR-1", NINE.plusHours(2)).id());
            assertEquals("PAT-1", store.get("APT-000001").patientId());
            assertEquals("PAT-2", store.get("APT-000002").patientId());
        }

        @Test
        void testLoadedSequenceBehindIds_NeverOverwrites() {
            book("PAT-1", "DR-1", NINE);
            book("PAT-2", "DR-1", NINE.plusHours(1));
            store.close();
            ScriptedStorage rewinding = new ScriptedStorage(new FileSnapshotStorage(config));
            rewinding.rewindSequenceTo = 1;
            store = newStore(rewinding);
            store.open();

            Appointment created = book("PAT-3", "DR-1", NINE.plusHours(2));

            assertEquals("APT-000003", created.id());
            assertEquals("PAT-1", store.get("APT-000001").patientId());
            assertEquals(3, store.list(AppointmentFilter.all()).size());
        }

        @Test
        void testFlush_AdvancesGeneration() {
            long before = store.statistics().generation();

            store.flush();

            assertEquals(before + 1, store.statistics().generation());
            assertTrue(Files.exists(tempDir.resolve("appointments.json")));
        }

        @Test
        void testSaveFailure_MarksDirtyUntilNextSave() {
            store.close();
            ScriptedStorage failing = new ScriptedStorage(new FileSnapshotStorage(config));
            store = newStore(failing);
            store.open();

            failing.failSaves = true;
            assertThrows(StoreWriteException.class, () -> book("PAT-1", "DR-1", NINE));
            assertTrue(store.isDirty());
            // the write stays in memory
            assertEquals("PAT-1", store.get("APT-000001").patientId());

            failing.failSaves = false;
            store.flush();
            assertFalse(store.isDirty());

            restart();
            assertEquals("PAT-1", store.get("APT-000001").patientId());
        }
    }

    // ========================================================================
    // Degraded Mode and Lifecycle
    // ========================================================================

    @Nested
    @DisplayName("Degraded mode")
    class DegradedTests {

        @BeforeEach
        void corruptStore() throws Exception {
            store.close();
            Files.writeString(tempDir.resolve("appointments.json"), "not a snapshot");
            store = newStore(new FileSnapshotStorage(config));
            store.open();
        }

        @Test
        void testUnrecoverableLoad_StartsEmptyAndRefusesWrites() {
            assertTrue(store.isDegraded());
            assertTrue(store.list(AppointmentFilter.all()).isEmpty());

            assertThrows(UnrecoverableStoreException.class, () -> book("PAT-1", "DR-1", NINE));
            assertThrows(UnrecoverableStoreException.class, () -> store.flush());
        }

        @Test
        void testResumeWithEmptyStore_QuarantinesAndRecovers() throws Exception {
            Path quarantined = store.resumeWithEmptyStore();

            assertFalse(store.isDegraded());
            assertEquals("not a snapshot", Files.readString(quarantined.resolve("appointments.json")));
            Appointment a = book("PAT-1", "DR-1", NINE);

            restart();
            assertFalse(store.isDegraded());
            assertEquals(a, store.get(a.id()));
        }

        @Test
        void testClose_LeavesDamagedFileAlone() throws Exception {
            store.close();

            assertEquals("not a snapshot", Files.readString(tempDir.resolve("appointments.json")));
            store = null;
        }
    }

    @Test
    void testClosedStore_RejectsOperations() {
        store.close();

        assertThrows(StoreClosedException.class, () -> store.get("APT-000001"));
        assertThrows(StoreClosedException.class, () -> book("PAT-1", "DR-1", NINE));
        store = null;
    }

    @Test
    void testResumeWhenHealthy_Rejected() {
        assertThrows(IllegalStateException.class, () -> store.resumeWithEmptyStore());
    }

    /** Delegates to a real storage but can be told to fail every save or rewind the loaded sequence. */
    private static final class ScriptedStorage implements SnapshotStorage {
        private final SnapshotStorage delegate;
        volatile boolean failSaves;
        volatile long rewindSequenceTo = -1;

        ScriptedStorage(SnapshotStorage delegate) {
            this.delegate = delegate;
        }

        @Override
        public CompletableFuture<Void> open(Path dataDir) {
            return delegate.open(dataDir);
        }

        @Override
        public CompletableFuture<StoreSnapshot> load() {
            if (rewindSequenceTo < 0) {
                return delegate.load();
            }
            return delegate.load().thenApply(s -> new StoreSnapshot(s.formatVersion(), s.generation(),
                    s.writtenAt(), rewindSequenceTo, s.appointments()));
        }

        @Override
        public CompletableFuture<Void> saveAtomic(StoreSnapshot snapshot) {
            if (failSaves) {
                return CompletableFuture.failedFuture(new StoreWriteException("simulated disk failure"));
            }
            return delegate.saveAtomic(snapshot);
        }

        @Override
        public CompletableFuture<List<Path>> listBackups() {
            return delegate.listBackups();
        }

        @Override
        public CompletableFuture<Path> quarantine() {
            return delegate.quarantine();
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
