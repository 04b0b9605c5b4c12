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

/**
 * Caller-supplied data for a new appointment. The store assigns the identifier,
 * the initial status and the timestamps.
 *
 * @param patientId      patient identifier (non-blank)
 * @param practitionerId practitioner identifier (non-blank)
 * @param scheduledAt    clinic-local start time
 * @param notes          free text, may be empty
 */
public record AppointmentDraft(
        String patientId,
        String practitionerId,
        LocalDateTime scheduledAt,
        String notes
) {

    /** Maximum length of the free-text notes field. */
    public static final int MAX_NOTES_LENGTH = 2000;

    public AppointmentDraft {
        requireText(patientId, "patientId");
        requireText(practitionerId, "practitionerId");
        if (scheduledAt == null) {
            throw new InvalidAppointmentException("scheduledAt is required");
        }
        notes = normalizeNotes(notes);
    }

    public static AppointmentDraft of(String patientId, String practitionerId, LocalDateTime scheduledAt) {
        return new AppointmentDraft(patientId, practitionerId, scheduledAt, "");
    }

    static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidAppointmentException(field + " must not be blank");
        }
    }

    static String normalizeNotes(String notes) {
        if (notes == null) {
            return "";
        }
        if (notes.length() > MAX_NOTES_LENGTH) {
            throw new InvalidAppointmentException(
                    "notes too long: " + notes.length() + " chars (max: " + MAX_NOTES_LENGTH + ")");
        }
        return notes;
    }
}
