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

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * A partial update to an existing appointment. Absent fields are left unchanged.
 * <p>
 * Factories cover the common cases:
 * <pre>{@code
 * store.update(id, AppointmentChanges.status(AppointmentStatus.COMPLETED));
 * store.update(id, AppointmentChanges.reschedule(newTime).withNotes("moved by phone"));
 * }</pre>
 *
 * @param status      target status
 * @param scheduledAt new start time
 * @param notes       replacement notes
 */
public record AppointmentChanges(
        Optional<AppointmentStatus> status,
        Optional<LocalDateTime> scheduledAt,
        Optional<String> notes
) {

    public AppointmentChanges {
        status = status == null ? Optional.empty() : status;
        scheduledAt = scheduledAt == null ? Optional.empty() : scheduledAt;
        notes = notes == null ? Optional.empty() : notes.map(AppointmentDraft::normalizeNotes);
        if (status.isEmpty() && scheduledAt.isEmpty() && notes.isEmpty()) {
            throw new InvalidAppointmentException("change set is empty");
        }
    }

    public static AppointmentChanges status(AppointmentStatus status) {
        return new AppointmentChanges(Optional.of(status), Optional.empty(), Optional.empty());
    }

    public static AppointmentChanges reschedule(LocalDateTime scheduledAt) {
        return new AppointmentChanges(Optional.empty(), Optional.of(scheduledAt), Optional.empty());
    }

    public static AppointmentChanges notes(String notes) {
        return new AppointmentChanges(Optional.empty(), Optional.empty(), Optional.of(notes));
    }

    public AppointmentChanges withStatus(AppointmentStatus value) {
        return new AppointmentChanges(Optional.of(value), scheduledAt, notes);
    }

    public AppointmentChanges withScheduledAt(LocalDateTime value) {
        return new AppointmentChanges(status, Optional.of(value), notes);
    }

    public AppointmentChanges withNotes(String value) {
        return new AppointmentChanges(status, scheduledAt, Optional.of(value));
    }
}
