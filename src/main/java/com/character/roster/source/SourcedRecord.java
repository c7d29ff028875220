package com.character.roster.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One raw character record tagged with where it came from.
 *
 * @param source    identifier used in messages (file name, positional index, ...)
 * @param data      the parsed field mapping, empty when the record is unreadable
 * @param readError why the record could not be read, or null if it was read
 */
public record SourcedRecord(String source, Map<String, Object> data, String readError) {

    public SourcedRecord {
        Objects.requireNonNull(source, "source is required");
        data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Map.of();
    }

    public static SourcedRecord of(String source, Map<String, ?> data) {
        Objects.requireNonNull(data, "data is required");
        return new SourcedRecord(source, new LinkedHashMap<String, Object>(data), null);
    }

    /**
     * A record whose content could not be parsed.
     */
    public static SourcedRecord unreadable(String source, String reason) {
        return new SourcedRecord(source, null, Objects.requireNonNull(reason, "reason is required"));
    }

    public boolean isReadable() {
        return readError == null;
    }
}
