package com.character.roster.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Record source backed by records already in memory.
 * Records passed as plain maps are tagged {@code record[0]}, {@code record[1]}, ...
 */
public class InMemoryRecordSource implements RecordSource {

    private final List<SourcedRecord> records;

    public InMemoryRecordSource(List<SourcedRecord> records) {
        this.records = records != null ? List.copyOf(records) : List.of();
    }

    /**
     * Creates a source tagging each record with its positional index.
     */
    public static InMemoryRecordSource of(List<? extends Map<String, ?>> records) {
        List<SourcedRecord> tagged = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            tagged.add(SourcedRecord.of(indexTag(i), records.get(i)));
        }
        return new InMemoryRecordSource(tagged);
    }

    static String indexTag(int index) {
        return "record[" + index + "]";
    }

    @Override
    public List<SourcedRecord> readRecords() {
        return records;
    }

    @Override
    public String describe() {
        return "in-memory(" + records.size() + " records)";
    }
}
