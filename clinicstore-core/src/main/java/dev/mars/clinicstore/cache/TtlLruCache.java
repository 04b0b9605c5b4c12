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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded cache with per-entry time-to-live and least-recently-used eviction.
 * <p>
 * <b>Liveness:</b> an entry is live while {@code now <= insertedAt + ttl}. A
 * lookup that finds an expired entry counts as a miss and removes it.
 * <p>
 * <b>Eviction:</b> when a put would exceed capacity, expired entries are
 * dropped first. If the cache is still full, the least recently accessed entry
 * goes; entries with the same last-access time are ordered by insertion time,
 * then by access order.
 * <p>
 * <b>Thread Safety:</b>
 * A lookup reorders entries, so every operation, reads included, takes the
 * same internal lock.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class TtlLruCache<K, V> {

    private static final Logger LOG = LoggerFactory.getLogger(TtlLruCache.class);

    private final int capacity;
    private final Duration ttl;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    /** Access-ordered: iteration starts at the least recently used entry. */
    private final LinkedHashMap<K, Entry<V>> entries;

    private long hits;
    private long misses;
    private long evictions;
    private long expirations;

    public TtlLruCache(int capacity, Duration ttl) {
        this(capacity, ttl, Clock.systemUTC());
    }

    public TtlLruCache(int capacity, Duration ttl, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, was " + capacity);
        }
        Objects.requireNonNull(ttl, "ttl");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, was " + ttl);
        }
        this.capacity = capacity;
        this.ttl = ttl;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.entries = new LinkedHashMap<>(16, 0.75f, true);
    }

    /**
     * Returns the live value for {@code key}, marking it most recently used.
     */
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key");
        lock.lock();
        try {
            Instant now = clock.instant();
            Entry<V> entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                entries.remove(key);
                expirations++;
                misses++;
                LOG.trace("Cache entry expired on lookup: {}", key);
                return Optional.empty();
            }
            entry.lastAccess = now;
            hits++;
            return Optional.of(entry.value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts or refreshes {@code key}. The expiry restarts from now.
     */
    public void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            Instant now = clock.instant();
            if (!entries.containsKey(key) && entries.size() >= capacity) {
                makeRoom(now);
            }
            entries.put(key, new Entry<>(value, now, now.plus(ttl)));
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(K key) {
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    public int sweep() {
        lock.lock();
        try {
            int removed = removeExpired(clock.instant());
            if (removed > 0) {
                LOG.debug("Cache sweep removed {} expired entries, {} remain", removed, entries.size());
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(entries.size(), capacity, hits, misses, evictions, expirations);
        } finally {
            lock.unlock();
        }
    }

    // Caller holds the lock.
    private void makeRoom(Instant now) {
        if (removeExpired(now) > 0 && entries.size() < capacity) {
            return;
        }
        K victim = selectVictim();
        entries.remove(victim);
        evictions++;
        LOG.trace("Cache full ({}), evicted least recently used: {}", capacity, victim);
    }

    private int removeExpired(Instant now) {
        int removed = 0;
        Iterator<Entry<V>> it = entries.values().iterator();
        while (it.hasNext()) {
            if (it.next().isExpired(now)) {
                it.remove();
                removed++;
            }
        }
        expirations += removed;
        return removed;
    }

    /**
     * The head of the access order holds the oldest last-access time. Among the
     * run of entries sharing it, the earliest inserted one loses.
     */
    private K selectVictim() {
        Iterator<Map.Entry<K, Entry<V>>> it = entries.entrySet().iterator();
        Map.Entry<K, Entry<V>> head = it.next();
        K victim = head.getKey();
        Instant oldestAccess = head.getValue().lastAccess;
        Instant earliestInsert = head.getValue().insertedAt;
        while (it.hasNext()) {
            Map.Entry<K, Entry<V>> next = it.next();
            if (!next.getValue().lastAccess.equals(oldestAccess)) {
                break;
            }
            if (next.getValue().insertedAt.isBefore(earliestInsert)) {
                victim = next.getKey();
                earliestInsert = next.getValue().insertedAt;
            }
        }
        return victim;
    }

    private static final class Entry<V> {
        final V value;
        final Instant insertedAt;
        final Instant expiresAt;
        Instant lastAccess;

        Entry(V value, Instant insertedAt, Instant expiresAt) {
            this.value = value;
            this.insertedAt = insertedAt;
            this.expiresAt = expiresAt;
            this.lastAccess = insertedAt;
        }

        boolean isExpired(Instant now) {
            return now.isAfter(expiresAt);
        }
    }
}
