package com.phillippitts.routineengine.service.store;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generic record held by the memory store. Routines are records whose metadata carries
 * {@code type="routine"}.
 *
 * @param id         store-assigned identifier
 * @param text       free text (searchable summary of the routine)
 * @param speaker    author of the record
 * @param kind       record kind, e.g. {@code routine}
 * @param persona    persona the record belongs to
 * @param importance 0-10 ranking hint
 * @param timestamp  when the record was first written
 * @param metadata   structured metadata bag
 */
public record MemoryRecord(
        String id,
        String text,
        String speaker,
        String kind,
        String persona,
        int importance,
        Instant timestamp,
        Map<String, Object> metadata
) {

    public MemoryRecord {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public MemoryRecord withContent(String newText, Map<String, Object> newMetadata) {
        return new MemoryRecord(id, newText, speaker, kind, persona, importance, timestamp, newMetadata);
    }

    public Object metadataValue(String key) {
        return metadata.get(key);
    }
}
