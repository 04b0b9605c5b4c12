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
package dev.mars.clinicstore.concurrency;

import dev.mars.clinicstore.ClinicStoreException;

/**
 * Thrown when a caller is interrupted while waiting for a lock.
 * <p>
 * The operation never entered its critical section, so it had no effect.
 */
public class OperationAbandonedException extends ClinicStoreException {

    public OperationAbandonedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
