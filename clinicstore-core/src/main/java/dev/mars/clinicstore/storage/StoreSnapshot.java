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

import dev.mars.clinicstore.model.Appointment;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The complete persisted state: every appointment keyed by identifier.
 * <p>
 * One snapshot file is the single source of truth. Backups are older
 * snapshots and are only read during recovery.
 *
 * @param formatVersion file format version
 * @param generation    save counter, incremented on every successful save
 * @param writtenAt     when this snapshot was produced
 * @param nextSequence  next identifier sequence number to hand out
 * @param appointments  identifier to appointment, sorted by identifier
 */
public record StoreSnapshot(
        int formatVersion,
        long generation,
        Instant writtenAt,
        long nextSequence,
        Map<String, Appointment> appointments
) {

    /** Format version written by this code. */
    public static final int CURRENT_FORMAT_VERSION = 1;

    private static final Pattern SEQUENCED_ID = Pattern.compile("APT-(\\d{1,18})");

    public StoreSnapshot {
        Objects.requireNonNull(writtenAt, "writtenAt");
        appointments = appointments == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new TreeMap<>(appointments));
    }

    /** State of a store that has never been written. */
    public static StoreSnapshot empty() {
        return new StoreSnapshot(CURRENT_FORMAT_VERSION, 0L, Instant.EPOCH, 1L, Map.of());
    }

    public Optional<Appointment> find(String id) {
        return Optional.ofNullable(appointments.get(id));
    }

    /**
     * Highest sequence number among the {@code APT-} identifiers held, or 0
     * when there are none. {@link #nextSequence()} must exceed it.
     */
    public long highestSequence() {
        long highest = 0;
        for (String id : appointments.keySet()) {
            Matcher m = SEQUENCED_ID.matcher(id);
            if (m.matches()) {
                highest = Math.max(highest, Long.parseLong(m.group(1)));
            }
        }
        return highest;
    }

    public int size() {
        return appointments.size();
    }
}
