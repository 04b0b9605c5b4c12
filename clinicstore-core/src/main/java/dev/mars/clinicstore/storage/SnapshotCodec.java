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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.clinicstore.model.Appointment;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.CRC32C;

/**
 * Encodes and decodes {@link StoreSnapshot} as indented JSON.
 * <p>
 * <b>File format (version 1):</b>
 * <pre>
 * {
 *   "format" : "clinicstore-snapshot",
 *   "version" : 1,
 *   "generation" : 42,
 *   "writtenAt" : "2026-10-19T09:15:00.123Z",
 *   "nextSequence" : 18,
 *   "recordCount" : 17,
 *   "checksum" : "8f3a01c2",
 *   "appointments" : [ { "id" : "APT-000001", ... }, ... ]
 * }
 * </pre>
 * The checksum is CRC32C over the compact encoding of the {@code appointments}
 * array, so a truncated or hand-edited record set is detected even when the
 * file still parses.
 */
final class SnapshotCodec {

    static final String FORMAT_TAG = "clinicstore-snapshot";

    private final ObjectMapper mapper;
    private final ObjectWriter prettyWriter;

    SnapshotCodec() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.prettyWriter = mapper.writerWithDefaultPrettyPrinter();
    }

    byte[] encode(StoreSnapshot snapshot) throws JsonProcessingException {
        ArrayNode records = mapper.valueToTree(new ArrayList<>(snapshot.appointments().values()));

        ObjectNode root = mapper.createObjectNode();
        root.put("format", FORMAT_TAG);
        root.put("version", snapshot.formatVersion());
        root.put("generation", snapshot.generation());
        root.put("writtenAt", snapshot.writtenAt().toString());
        root.put("nextSequence", snapshot.nextSequence());
        root.put("recordCount", records.size());
        root.put("checksum", checksum(records));
        root.set("appointments", records);

        return prettyWriter.writeValueAsBytes(root);
    }

    /**
     * Decodes and validates a snapshot.
     *
     * @param bytes  raw file content
     * @param source file the bytes came from, for error messages
     * @throws CorruptStoreException if any structural or integrity check fails
     */
    StoreSnapshot decode(byte[] bytes, Path source) {
        if (bytes.length == 0) {
            throw new CorruptStoreException(source, "file is empty");
        }

        JsonNode root;
        try {
            root = mapper.readTree(bytes);
        } catch (JsonProcessingException e) {
            throw new CorruptStoreException(source, "malformed JSON (" + e.getOriginalMessage() + ")", e);
        } catch (IOException e) {
            throw new CorruptStoreException(source, "unreadable content", e);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptStoreException(source, "top-level value is not an object");
        }

        String format = root.path("format").asText(null);
        if (!FORMAT_TAG.equals(format)) {
            throw new CorruptStoreException(source, "unexpected format tag: " + format);
        }
        JsonNode versionNode = root.path("version");
        if (!versionNode.isInt()) {
            throw new CorruptStoreException(source, "missing format version");
        }
        int version = versionNode.intValue();
        if (version < 1 || version > StoreSnapshot.CURRENT_FORMAT_VERSION) {
            throw new CorruptStoreException(source, "unsupported format version " + version);
        }

        long generation = requireNonNegativeLong(root, "generation", source);
        long nextSequence = requireNonNegativeLong(root, "nextSequence", source);
        Instant writtenAt;
        try {
            writtenAt = Instant.parse(root.path("writtenAt").asText(""));
        } catch (DateTimeParseException e) {
            throw new CorruptStoreException(source, "invalid writtenAt", e);
        }

        JsonNode records = root.path("appointments");
        if (!records.isArray()) {
            throw new CorruptStoreException(source, "missing appointments array");
        }
        String expectedChecksum = root.path("checksum").asText("");
        String actualChecksum;
        try {
            actualChecksum = checksum(records);
        } catch (JsonProcessingException e) {
            throw new CorruptStoreException(source, "cannot re-encode appointments", e);
        }
        if (!actualChecksum.equals(expectedChecksum)) {
            throw new CorruptStoreException(source,
                    "checksum mismatch (stored=" + expectedChecksum + ", computed=" + actualChecksum + ")");
        }
        if (root.path("recordCount").asInt(-1) != records.size()) {
            throw new CorruptStoreException(source,
                    "record count mismatch (stored=" + root.path("recordCount").asText() + ", actual=" + records.size() + ")");
        }

        Map<String, Appointment> appointments = new LinkedHashMap<>();
        for (JsonNode node : records) {
            Appointment appointment;
            try {
                appointment = mapper.treeToValue(node, Appointment.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new CorruptStoreException(source, "invalid appointment record " + node.path("id").asText("?"), e);
            }
            if (appointments.putIfAbsent(appointment.id(), appointment) != null) {
                throw new CorruptStoreException(source, "duplicate appointment id " + appointment.id());
            }
        }

        StoreSnapshot snapshot = new StoreSnapshot(version, generation, writtenAt, nextSequence, appointments);
        if (nextSequence <= snapshot.highestSequence()) {
            throw new CorruptStoreException(source, "nextSequence " + nextSequence
                    + " would reissue existing id (highest sequence " + snapshot.highestSequence() + ")");
        }
        return snapshot;
    }

    private String checksum(JsonNode records) throws JsonProcessingException {
        byte[] canonical = mapper.writeValueAsBytes(records);
        CRC32C crc = new CRC32C();
        crc.update(canonical, 0, canonical.length);
        return String.format("%08x", crc.getValue());
    }

    private static long requireNonNegativeLong(JsonNode root, String field, Path source) {
        JsonNode node = root.path(field);
        if (!node.canConvertToLong() || node.longValue() < 0) {
            throw new CorruptStoreException(source, "invalid " + field + ": " + node);
        }
        return node.longValue();
    }
}
