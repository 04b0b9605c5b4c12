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
 * Business rule consulted before an appointment is stored.
 * <p>
 * Runs inside the write critical section, so {@code existing} cannot change
 * while the rule looks at it.
 */
@FunctionalInterface
public interface BookingRule {

    /**
     * @param candidate the appointment about to be stored
     * @param existing  every stored appointment, possibly including an older
     *                  version of {@code candidate}
     * @throws BookingConflictException if the candidate may not be stored
     */
    void check(Appointment candidate, Collection<Appointment> existing);
}
