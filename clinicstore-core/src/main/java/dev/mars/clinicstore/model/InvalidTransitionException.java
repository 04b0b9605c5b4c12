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

import dev.mars.clinicstore.ClinicStoreException;

/**
 * Raised when an update would move an appointment out of a terminal state,
 * or reschedule an appointment that is already completed or cancelled.
 */
public class InvalidTransitionException extends ClinicStoreException {

    private final String appointmentId;
    private final AppointmentStatus from;
    private final AppointmentStatus to;

    public InvalidTransitionException(String appointmentId, AppointmentStatus from, AppointmentStatus to) {
        super("Appointment " + appointmentId + " cannot move from " + from.wireName() + " to " + to.wireName());
        this.appointmentId = appointmentId;
        this.from = from;
        this.to = to;
    }

    public InvalidTransitionException(String appointmentId, AppointmentStatus current, String message) {
        super("Appointment " + appointmentId + " (" + current.wireName() + "): " + message);
        this.appointmentId = appointmentId;
        this.from = current;
        this.to = current;
    }

    public String appointmentId() {
        return appointmentId;
    }

    public AppointmentStatus from() {
        return from;
    }

    public AppointmentStatus to() {
        return to;
    }
}
