package com.character.roster.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordSourceTest {

    @Test
    @DisplayName("Should tag records with their positional index")
    void testIndexTags() {
        InMemoryRecordSource source = InMemoryRecordSource.of(List.of(Map.of("id", "A"), Map.of("id", "B")));

        List<SourcedRecord> records = source.readRecords();

        assertEquals("record[0]", records.get(0).source());
        assertEquals("record[1]", records.get(1).source());
        assertEquals("in-memory(2 records)", source.describe());
    }

    @Test
    @DisplayName("Should snapshot record data")
    void testSnapshot() {
        Map<String, Object> data = new HashMap<>();
        data.put("id", "A");
        data.put("bio", null);
        SourcedRecord record = SourcedRecord.of("a.yaml", data);

        data.put("id", "B");

        assertEquals("A", record.data().get("id"));
        assertTrue(record.data().containsKey("bio"));
        assertThrows(UnsupportedOperationException.class, () -> record.data().put("x", 1));
    }
}
