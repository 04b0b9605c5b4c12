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
package dev.mars.clinicstore.cache;

/**
 * Point-in-time counters of a {@link TtlLruCache}.
 *
 * @param size        live and not yet swept entries
 * @param capacity    maximum number of entries
 * @param hits        lookups answered from a live entry
 * @param misses      lookups that found nothing or an expired entry
 * @param evictions   entries removed to make room
 * @param expirations entries removed because their TTL elapsed
 */
public record CacheStats(
        int size,
        int capacity,
        long hits,
        long misses,
        long evictions,
        long expirations
) {

    /**
     * Fraction of lookups that were hits, or 0 when there were none.
     */
    public double hitRate() {
        long lookups = hits + misses;
        return lookups == 0 ? 0.0 : (double) hits / lookups;
    }
}
