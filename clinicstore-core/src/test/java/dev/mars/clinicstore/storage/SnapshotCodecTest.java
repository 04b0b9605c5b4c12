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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.clinicstore.model.Appointment;
import dev.mars.clinicstore.model.AppointmentDraft;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.function.Consumer;
import java.util.zip.CRC32C;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link SnapshotCodec} integrity checks.
 */
class SnapshotCodecTest {

    private static final Path SOURCE = Path.of("appointments.json");
    private static final Instant T0 = Instant.parse("2026-10-19T08:00:00Z");

    private final SnapshotCodec codec = new SnapshotCodec();
    private final ObjectMapper json = new ObjectMapper();

    private static StoreSnapshot sample() {
        Appointment a = Appointment.schedule("APT-000001",
                new AppointmentDraft("PAT-1", "DR-1", LocalDateTime.of(2026, 11, 2, 9, 0), "café ☕"), T0);
        return new StoreSnapshot(1, 7, T0, 2, Map.of(a.id(), a));
    }

    /** Re-encodes after {@code edit}, optionally fixing up the checksum so only the edit is wrong. */
    private byte[] edited(Consumer<ObjectNode> edit, boolean fixChecksum) throws Exception {
        ObjectNode root = (ObjectNode) json.readTree(codec.encode(sample()));
        edit.accept(root);
        if (fixChecksum) {
            byte[] canonical = json.writeValueAsBytes(root.get("appointments"));
            CRC32C crc = new CRC32C();
            crc.update(canonical, 0, canonical.length);
            root.put("checksum", String.format("%08x", crc.getValue()));
        }
        return json.writeValueAsBytes(root);
    }

    private CorruptStoreException assertCorrupt(byte[] bytes) {
        CorruptStoreException e = assertThrows(CorruptStoreException.class, () -> codec.decode(bytes, SOURCE));
        assertEquals(SOURCE, e.file());
        return e;
    }

    @Test
    void testEncodeDecode_PreservesEverything() throws Exception {
        StoreSnapshot decoded = codec.decode(codec.encode(sample()), SOURCE);

        assertEquals(sample(), decoded);
    }

    @Test
    void testUnknownFieldsIgnored() throws Exception {
        byte[] bytes = edited(root -> root.put("comment", "added by hand"), false);

        assertEquals(1, codec.decode(bytes, SOURCE).size());
    }

    @Test
    void testRejectsEmptyAndMalformed() {
        assertCorrupt(new byte[0]);
        assertCorrupt("{\"format\": ".getBytes(StandardCharsets.UTF_8));
        assertCorrupt("[1, 2]".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testRejectsWrongFormatOrVersion() throws Exception {
        assertCorrupt(edited(root -> root.put("format", "something-else"), false));
        assertCorrupt(edited(root -> root.put("version", 2), false));
        assertCorrupt(edited(root -> root.remove("version"), false));
        assertCorrupt(edited(root -> root.put("generation", -1), false));
    }

    @Test
    void testRejectsChecksumMismatch() throws Exception {
        CorruptStoreException e = assertCorrupt(edited(
                root -> ((ObjectNode) ((ArrayNode) root.get("appointments")).get(0)).put("notes", "edited"), false));

        assertTrue(e.getMessage().contains("checksum"), e.getMessage());
    }

    @Test
    void testRejectsSequenceThatWouldReissueId() throws Exception {
        CorruptStoreException e = assertCorrupt(edited(root -> root.put("nextSequence", 1), false));

        assertTrue(e.getMessage().contains("nextSequence"), e.getMessage());
        assertEquals(2, codec.decode(edited(root -> root.put("nextSequence", 2), false), SOURCE).nextSequence());
    }

    @Test
    void testRejectsRecordCountMismatch() throws Exception {
        assertCorrupt(edited(root -> root.put("recordCount", 5), false));
    }

    @Test
    void testRejectsDuplicateIds() throws Exception {
        CorruptStoreException e = assertCorrupt(edited(root -> {
            ArrayNode records = (ArrayNode) root.get("appointments");
            records.add(records.get(0).deepCopy());
            root.put("recordCount", 2);
        }, true));

        assertTrue(e.getMessage().contains("duplicate"), e.getMessage());
    }

    @Test
    void testRejectsInvalidRecord() throws Exception {
        assertCorrupt(edited(root ->
                ((ObjectNode) ((ArrayNode) root.get("appointments")).get(0)).put("status", "no-show"), true));
        assertCorrupt(edited(root ->
                ((ObjectNode) ((ArrayNode) root.get("appointments")).get(0)).put("patientId", " "), true));
    }
}
