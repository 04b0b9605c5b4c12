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
package dev.mars.clinicstore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle states of an {@link Appointment}.
 * <p>
 * Transitions only move forward: {@code scheduled -> completed} or
 * {@code scheduled -> cancelled}. Both end states are terminal.
 */
public enum AppointmentStatus {

    SCHEDULED("scheduled"),
    COMPLETED("completed"),
    CANCELLED("cancelled");

    private final String wireName;

    AppointmentStatus(String wireName) {
        this.wireName = wireName;
    }

    /** Lowercase name used in the snapshot file. */
    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static AppointmentStatus fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Appointment status must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AppointmentStatus status : values()) {
            if (status.wireName.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown appointment status: " + value);
    }

    public boolean isTerminal() {
        return this != SCHEDULED;
    }

    /**
     * Staying in the same state is always allowed (no-op). Leaving a terminal
     * state is never allowed.
     */
    public boolean canTransitionTo(AppointmentStatus target) {
        return this == target || this == SCHEDULED;
    }
}
