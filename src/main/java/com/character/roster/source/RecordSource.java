package com.character.roster.source;

import java.util.List;

/**
 * Produces the raw character records for a load run.
 * Implementations decide where records come from (directory, fixture, network).
 */
public interface RecordSource {

    /**
     * Reads all records. Records that exist but cannot be parsed are returned as
     * {@link SourcedRecord#unreadable(String, String)} rather than failing the whole read.
     *
     * @return the records, in a stable order
     * @throws RecordSourceException if the source itself is unavailable
     */
    List<SourcedRecord> readRecords();

    /**
     * Human-readable description of the source, used in log messages.
     */
    String describe();
}
