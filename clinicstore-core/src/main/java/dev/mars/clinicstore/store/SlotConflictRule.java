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

import dev.mars.clinicstore.model.Appointment;

import java.util.Collection;

/**
 * A practitioner cannot hold two active appointments starting at the same time.
 * Cancelled appointments free their slot.
 */
public final class SlotConflictRule implements BookingRule {

    @Override
    public void check(Appointment candidate, Collection<Appointment> existing) {
        if (!candidate.occupiesSlot()) {
            return;
        }
        for (Appointment other : existing) {
            if (other.id().equals(candidate.id()) || !other.occupiesSlot()) {
                continue;
            }
            if (other.practitionerId().equals(candidate.practitionerId())
                    && other.scheduledAt().equals(candidate.scheduledAt())) {
                throw new BookingConflictException(candidate, other);
            }
        }
    }
}
