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
package dev.mars.clinicstore.maintenance;

import dev.mars.clinicstore.storage.StoreConfig;
import dev.mars.clinicstore.store.AppointmentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs the store's periodic housekeeping on background daemon threads.
 * <ul>
 *   <li><b>Sweep:</b> every {@code sweepInterval}, drops expired cache entries.</li>
 *   <li><b>Flush:</b> every {@code flushInterval}, saves a snapshot even when
 *       nothing changed. Skipped while the store is degraded.</li>
 * </ul>
 * A failing run is logged and the task fires again at its next tick.
 */
public final class MaintenanceScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final AppointmentStore store;
    private final Duration sweepInterval;
    private final Duration flushInterval;
    private final ScheduledExecutorService executor;

    private final AtomicLong sweepRuns = new AtomicLong();
    private final AtomicLong flushRuns = new AtomicLong();
    private final AtomicLong failedRuns = new AtomicLong();

    private boolean started;
    private boolean closed;

    public MaintenanceScheduler(AppointmentStore store, StoreConfig config) {
        this(store, config.sweepInterval(), config.flushInterval());
    }

    public MaintenanceScheduler(AppointmentStore store, Duration sweepInterval, Duration flushInterval) {
        this.store = Objects.requireNonNull(store, "store");
        this.sweepInterval = requirePositive(sweepInterval, "sweepInterval");
        this.flushInterval = requirePositive(flushInterval, "flushInterval");

        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "store-maintenance-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Schedules both tasks. Calling it again has no effect.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Maintenance scheduler is closed");
        }
        if (started) {
            return;
        }
        started = true;
        executor.scheduleWithFixedDelay(this::sweep,
                sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);
        executor.scheduleWithFixedDelay(this::flush,
                flushInterval.toMillis(), flushInterval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Maintenance started: sweep every {}, flush every {}", sweepInterval, flushInterval);
    }

    /**
     * Stops both tasks, waiting briefly for a run in progress.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Maintenance tasks did not stop within 5 s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LOG.info("Maintenance stopped: sweeps={}, flushes={}, failures={}",
                sweepRuns.get(), flushRuns.get(), failedRuns.get());
    }

    public long sweepRuns() {
        return sweepRuns.get();
    }

    public long flushRuns() {
        return flushRuns.get();
    }

    public long failedRuns() {
        return failedRuns.get();
    }

    void sweep() {
        try {
            int removed = store.sweepCache();
            sweepRuns.incrementAndGet();
            LOG.trace("Sweep removed {} expired cache entries", removed);
        } catch (RuntimeException e) {
            failedRuns.incrementAndGet();
            LOG.error("Cache sweep failed: {}", e.getMessage(), e);
        }
    }

    void flush() {
        if (store.isDegraded()) {
            LOG.debug("Skipping scheduled flush, store is degraded");
            return;
        }
        try {
            store.flush();
            flushRuns.incrementAndGet();
        } catch (RuntimeException e) {
            failedRuns.incrementAndGet();
            LOG.error("Scheduled flush failed: {}", e.getMessage(), e);
        }
    }

    private static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, was " + value);
        }
        return value;
    }
}
