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

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.Objects;

/**
 * An appointment record as held by the store and written to the snapshot file.
 * <p>
 * Instances are immutable. Every mutation produces a new instance with a
 * fresh {@code updatedAt}; the identifier and {@code createdAt} never change.
 *
 * @param id             store-assigned identifier
 * @param patientId      patient identifier
 * @param practitionerId practitioner identifier
 * @param scheduledAt    clinic-local start time
 * @param status         lifecycle state
 * @param notes          free text, never null
 * @param createdAt      creation instant
 * @param updatedAt      last-modified instant
 */
@JsonPropertyOrder({"id", "patientId", "practitionerId", "scheduledAt", "status", "notes", "createdAt", "updatedAt"})
public record Appointment(
        String id,
        String patientId,
        String practitionerId,
        LocalDateTime scheduledAt,
        AppointmentStatus status,
        String notes,
        Instant createdAt,
        Instant updatedAt
) {

    /** Listing order: start time, then identifier. */
    public static final Comparator<Appointment> BY_SCHEDULE =
            Comparator.comparing(Appointment::scheduledAt).thenComparing(Appointment::id);

    public Appointment {
        AppointmentDraft.requireText(id, "id");
        AppointmentDraft.requireText(patientId, "patientId");
        AppointmentDraft.requireText(practitionerId, "practitionerId");
        Objects.requireNonNull(scheduledAt, "scheduledAt");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        notes = notes == null ? "" : notes;
    }

    /**
     * Creates a new {@link AppointmentStatus#SCHEDULED} appointment from a draft.
     */
    public static Appointment schedule(String id, AppointmentDraft draft, Instant now) {
        return new Appointment(id, draft.patientId(), draft.practitionerId(), draft.scheduledAt(),
                AppointmentStatus.SCHEDULED, draft.notes(), now, now);
    }

    /**
     * Returns a copy with the changes applied.
     *
     * @throws InvalidTransitionException if the status change is not allowed, or
     *                                    a terminal appointment would be rescheduled
     */
    public Appointment apply(AppointmentChanges changes, Instant now) {
        AppointmentStatus nextStatus = changes.status().orElse(status);
        if (!status.canTransitionTo(nextStatus)) {
            throw new InvalidTransitionException(id, status, nextStatus);
        }
        LocalDateTime nextTime = changes.scheduledAt().orElse(scheduledAt);
        if (status.isTerminal() && !nextTime.equals(scheduledAt)) {
            throw new InvalidTransitionException(id, status, "cannot reschedule");
        }
        return new Appointment(id, patientId, practitionerId, nextTime, nextStatus,
                changes.notes().orElse(notes), createdAt, now);
    }

    /** Cancelled appointments release their slot. */
    public boolean occupiesSlot() {
        return status != AppointmentStatus.CANCELLED;
    }
}
