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
package dev.mars.clinicstore.storage;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link StoreConfig} resolution order and validation.
 */
class StoreConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("clinicstore.dataDir");
        System.clearProperty("clinicstore.cacheCapacity");
        System.clearProperty("clinicstore.cacheTtlSeconds");
        System.clearProperty("clinicstore.backupRetention");
        System.clearProperty("clinicstore.syncEnabled");
        System.clearProperty("clinicstore.verifyWrites");
    }

    // ========================================================================
    // Defaults
    // ========================================================================

    @Test
    @DisplayName("Defaults apply when nothing is configured")
    void testDefaults() {
        StoreConfig config = StoreConfig.load();

        assertEquals(100, config.cacheCapacity());
        assertEquals(Duration.ofSeconds(300), config.cacheTtl());
        assertEquals(5, config.backupRetention());
        assertEquals(Duration.ofSeconds(30), config.sweepInterval());
        assertEquals(Duration.ofSeconds(300), config.flushInterval());
        assertTrue(config.syncEnabled());
        assertFalse(config.verifyWrites());
        assertEquals(16L * 1024 * 1024, config.minFreeSpaceBytes());
    }

    // ========================================================================
    // System Property Resolution
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property dataDir is respected")
        void testDataDirSystemProperty() {
            Path customDir = tempDir.resolve("custom-data");
            System.setProperty("clinicstore.dataDir", customDir.toString());

            assertEquals(customDir, StoreConfig.load().dataDir());
        }

        @Test
        @DisplayName("Numeric and boolean properties are parsed")
        void testTypedProperties() {
            System.setProperty("clinicstore.cacheCapacity", "42");
            System.setProperty("clinicstore.cacheTtlSeconds", "7");
            System.setProperty("clinicstore.syncEnabled", "false");
            System.setProperty("clinicstore.verifyWrites", "true");

            StoreConfig config = StoreConfig.load();

            assertEquals(42, config.cacheCapacity());
            assertEquals(Duration.ofSeconds(7), config.cacheTtl());
            assertFalse(config.syncEnabled());
            assertTrue(config.verifyWrites());
        }

        @Test
        @DisplayName("Unparseable number falls back to the default")
        void testInvalidIntSystemProperty() {
            System.setProperty("clinicstore.cacheCapacity", "lots");

            assertEquals(100, StoreConfig.load().cacheCapacity());
        }
    }

    // ========================================================================
    // Programmatic Overrides
    // ========================================================================

    @Nested
    @DisplayName("Programmatic Overrides")
    class ProgrammaticOverrideTests {

        @Test
        @DisplayName("Builder value beats system property")
        void testBuilderWins() {
            System.setProperty("clinicstore.backupRetention", "9");

            StoreConfig config = StoreConfig.builder().backupRetention(2).build();

            assertEquals(2, config.backupRetention());
        }

        @Test
        @DisplayName("Out of range values are rejected")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> StoreConfig.builder().cacheCapacity(0).build());
            assertThrows(IllegalArgumentException.class, () -> StoreConfig.builder().cacheTtl(Duration.ZERO).build());
            assertThrows(IllegalArgumentException.class, () -> StoreConfig.builder().backupRetention(-1).build());
            assertThrows(IllegalArgumentException.class,
                    () -> StoreConfig.builder().flushInterval(Duration.ofSeconds(-1)).build());
        }

        @Test
        @DisplayName("Zero retention is allowed")
        void testZeroRetention() {
            assertEquals(0, StoreConfig.builder().backupRetention(0).build().backupRetention());
        }
    }
}
