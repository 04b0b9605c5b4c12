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

import dev.mars.clinicstore.cache.CacheStats;
import dev.mars.clinicstore.model.AppointmentStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Snapshot of store counters.
 *
 * @param total      number of stored appointments
 * @param byStatus   count per status, every status present
 * @param generation generation of the last saved snapshot
 * @param degraded   whether writes are refused after an unrecoverable load
 * @param dirty      whether memory holds changes not yet saved
 * @param cache      cache counters
 */
public record StoreStatistics(
        int total,
        Map<AppointmentStatus, Long> byStatus,
        long generation,
        boolean degraded,
        boolean dirty,
        CacheStats cache
) {

    public StoreStatistics {
        Map<AppointmentStatus, Long> counts = new EnumMap<>(AppointmentStatus.class);
        for (AppointmentStatus status : AppointmentStatus.values()) {
            counts.put(status, byStatus.getOrDefault(status, 0L));
        }
        byStatus = Collections.unmodifiableMap(counts);
    }

    public long count(AppointmentStatus status) {
        return byStatus.get(status);
    }
}
