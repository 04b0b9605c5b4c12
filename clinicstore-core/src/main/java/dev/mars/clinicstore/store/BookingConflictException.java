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

import dev.mars.clinicstore.ClinicStoreException;
import dev.mars.clinicstore.model.Appointment;

/**
 * Thrown when a booking collides with an existing appointment.
 */
public class BookingConflictException extends ClinicStoreException {

    private final String conflictingId;

    public BookingConflictException(Appointment candidate, Appointment existing) {
        super("Practitioner " + candidate.practitionerId() + " is already booked at "
                + candidate.scheduledAt() + " by appointment " + existing.id());
        this.conflictingId = existing.id();
    }

    /**
     * Identifier of the appointment already holding the slot.
     */
    public String conflictingId() {
        return conflictingId;
    }
}
