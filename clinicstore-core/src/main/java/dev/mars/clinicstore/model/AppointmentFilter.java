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

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Criteria for {@code AppointmentStore.list}. Unset criteria match everything;
 * set criteria are combined with AND.
 * <pre>{@code
 * AppointmentFilter filter = AppointmentFilter.builder()
 *     .practitionerId("dr-house")
 *     .status(AppointmentStatus.SCHEDULED)
 *     .date(LocalDate.of(2026, 11, 25))
 *     .build();
 * }</pre>
 */
public final class AppointmentFilter {

    private static final AppointmentFilter ALL = builder().build();

    private final String patientId;
    private final String practitionerId;
    private final AppointmentStatus status;
    private final LocalDate date;
    private final LocalDateTime from;
    private final LocalDateTime to;

    private AppointmentFilter(Builder builder) {
        this.patientId = builder.patientId;
        this.practitionerId = builder.practitionerId;
        this.status = builder.status;
        this.date = builder.date;
        this.from = builder.from;
        this.to = builder.to;
    }

    public static AppointmentFilter all() {
        return ALL;
    }

    public static AppointmentFilter forPatient(String patientId) {
        return builder().patientId(patientId).build();
    }

    public static AppointmentFilter forPractitioner(String practitionerId) {
        return builder().practitionerId(practitionerId).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(Appointment appointment) {
        if (patientId != null && !patientId.equals(appointment.patientId())) {
            return false;
        }
        if (practitionerId != null && !practitionerId.equals(appointment.practitionerId())) {
            return false;
        }
        if (status != null && status != appointment.status()) {
            return false;
        }
        LocalDateTime at = appointment.scheduledAt();
        if (date != null && !date.equals(at.toLocalDate())) {
            return false;
        }
        if (from != null && at.isBefore(from)) {
            return false;
        }
        // upper bound is exclusive
        return to == null || at.isBefore(to);
    }

    @Override
    public String toString() {
        return "AppointmentFilter{" +
                "patientId=" + patientId +
                ", practitionerId=" + practitionerId +
                ", status=" + status +
                ", date=" + date +
                ", from=" + from +
                ", to=" + to +
                '}';
    }

    /**
     * Builder for {@link AppointmentFilter}.
     */
    public static final class Builder {
        private String patientId;
        private String practitionerId;
        private AppointmentStatus status;
        private LocalDate date;
        private LocalDateTime from;
        private LocalDateTime to;

        private Builder() {
        }

        public Builder patientId(String patientId) {
            this.patientId = patientId;
            return this;
        }

        public Builder practitionerId(String practitionerId) {
            this.practitionerId = practitionerId;
            return this;
        }

        public Builder status(AppointmentStatus status) {
            this.status = status;
            return this;
        }

        /** Restricts to one calendar day (clinic-local). */
        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        /** Half-open range {@code [from, to)}; either end may be left open. */
        public Builder between(LocalDateTime from, LocalDateTime to) {
            if (from != null && to != null && to.isBefore(from)) {
                throw new InvalidAppointmentException("range end " + to + " is before start " + from);
            }
            this.from = from;
            this.to = to;
            return this;
        }

        public AppointmentFilter build() {
            return new AppointmentFilter(this);
        }
    }
}
