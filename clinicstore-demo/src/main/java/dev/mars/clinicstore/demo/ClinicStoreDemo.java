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
package dev.mars.clinicstore.demo;

import dev.mars.clinicstore.maintenance.MaintenanceScheduler;
import dev.mars.clinicstore.model.Appointment;
import dev.mars.clinicstore.model.AppointmentChanges;
import dev.mars.clinicstore.model.AppointmentDraft;
import dev.mars.clinicstore.model.AppointmentFilter;
import dev.mars.clinicstore.model.AppointmentStatus;
import dev.mars.clinicstore.storage.StoreConfig;
import dev.mars.clinicstore.store.AppointmentStore;
import dev.mars.clinicstore.store.BookingConflictException;
import dev.mars.clinicstore.store.StoreStatistics;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Demo entry point for the clinic appointment store.
 * <p>
 * This demonstrates:
 * <ul>
 *   <li>Opening the store and reloading what earlier runs saved</li>
 *   <li>Booking, rescheduling, completing and cancelling appointments</li>
 *   <li>Eight threads racing for the same practitioner slot; exactly one wins</li>
 *   <li>Background maintenance and the final save on close</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link StoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (data directory only)</li>
 *   <li>System properties: {@code -Dclinicstore.dataDir=/path -Dclinicstore.cacheTtlSeconds=60 ...}</li>
 *   <li>Environment variables: {@code CLINICSTORE_DATA_DIR, CLINICSTORE_CACHE_CAPACITY, ...}</li>
 *   <li>Properties file: {@code clinicstore.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl clinicstore-demo -am
 *
 * # Run with default configuration
 * java -jar clinicstore-demo/target/clinicstore-demo-1.0-SNAPSHOT.jar
 *
 * # Run with CLI data directory override
 * java -jar clinicstore-demo/target/clinicstore-demo-1.0-SNAPSHOT.jar /path/to/data
 * </pre>
 *
 * @see StoreConfig
 */
public class ClinicStoreDemo {

    private static final int RACERS = 8;

    public static void main(String[] args) throws Exception {
        System.out.println("+---------------------------------------+");
        System.out.println("|      Clinic Appointment Store Demo    |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        StoreConfig config = args.length > 0 && !args[0].isBlank()
                ? StoreConfig.builder().dataDir(args[0]).build()
                : StoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (AppointmentStore store = new AppointmentStore(config);
             MaintenanceScheduler maintenance = new MaintenanceScheduler(store, config)) {
            store.open();
            System.out.println("[OK] Store opened at: " + config.dataDir().toAbsolutePath());
            if (store.isDegraded()) {
                System.out.println("[!!] Store is DEGRADED: no valid snapshot or backup could be loaded.");
                System.out.println("     Quarantining damaged files and starting empty.");
                System.out.println("[OK] Damaged files moved to: " + store.resumeWithEmptyStore());
            }
            maintenance.start();

            List<Appointment> existing = store.list(AppointmentFilter.all());
            System.out.println("[OK] Loaded " + existing.size() + " existing appointments");
            int start = Math.max(0, existing.size() - 3);
            for (int i = start; i < existing.size(); i++) {
                printAppointment(existing.get(i));
            }

            // Each run books the next free day so reruns do not collide with earlier ones
            LocalDate day = LocalDate.of(2026, 1, 5).plusDays(existing.size());
            LocalDateTime nine = day.atTime(LocalTime.of(9, 0));

            Appointment first = store.create(new AppointmentDraft("PAT-100", "DR-SILVA", nine, "first visit"));
            Appointment second = store.create(AppointmentDraft.of("PAT-200", "DR-SILVA", nine.plusMinutes(30)));
            Appointment third = store.create(AppointmentDraft.of("PAT-300", "DR-COSTA", nine));
            System.out.println("\n[OK] Booked 3 appointments:");
            printAppointment(first);
            printAppointment(second);
            printAppointment(third);

            Appointment moved = store.update(second.id(),
                    AppointmentChanges.reschedule(nine.plusHours(1)).withNotes("patient asked for later"));
            System.out.println("\n[OK] Rescheduled " + moved.id() + " to " + moved.scheduledAt());

            store.complete(first.id());
            store.cancel(third.id());
            System.out.println("[OK] Completed " + first.id() + ", cancelled " + third.id());

            System.out.println("\n  Racing " + RACERS + " threads for DR-LIMA at " + nine + "...");
            int winners = raceForSlot(store, nine);
            System.out.println("[OK] " + winners + " booking succeeded, "
                    + (RACERS - winners) + " rejected as conflicts");

            store.flush();
            StoreStatistics stats = store.statistics();
            System.out.println("\n  Statistics:");
            System.out.println("    total=" + stats.total()
                    + ", scheduled=" + stats.count(AppointmentStatus.SCHEDULED)
                    + ", completed=" + stats.count(AppointmentStatus.COMPLETED)
                    + ", cancelled=" + stats.count(AppointmentStatus.CANCELLED));
            System.out.println("    generation=" + stats.generation() + ", degraded=" + stats.degraded());
            System.out.printf("    cache: size=%d/%d, hits=%d, misses=%d, hitRate=%.2f%n",
                    stats.cache().size(), stats.cache().capacity(),
                    stats.cache().hits(), stats.cache().misses(), stats.cache().hitRate());

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Demo complete!                       |");
            System.out.println("|  Run again to see records reloaded.   |");
            System.out.println("+---------------------------------------+");
        }
    }

    private static int raceForSlot(AppointmentStore store, LocalDateTime slot) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(RACERS);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < RACERS; i++) {
                String patient = "PAT-RACE-" + i;
                results.add(pool.submit(() -> {
                    go.await();
                    try {
                        store.create(AppointmentDraft.of(patient, "DR-LIMA", slot));
                        return true;
                    } catch (BookingConflictException e) {
                        return false;
                    }
                }));
            }
            go.countDown();
            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    winners++;
                }
            }
            return winners;
        } finally {
            pool.shutdownNow();
        }
    }

    private static void printAppointment(Appointment a) {
        System.out.printf("    [%s] %s with %s at %s (%s)%s%n",
                a.id(), a.patientId(), a.practitionerId(), a.scheduledAt(), a.status().wireName(),
                a.notes().isEmpty() ? "" : " - " + a.notes());
    }
}
