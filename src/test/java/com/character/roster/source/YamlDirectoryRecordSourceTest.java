package com.character.roster.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class YamlDirectoryRecordSourceTest {

    @TempDir
    Path dir;

    static Path fixtureDirectory() throws URISyntaxException {
        return Path.of(YamlDirectoryRecordSourceTest.class.getResource("/characters").toURI());
    }

    @Test
    @DisplayName("Should read yaml and yml files in file-name order")
    void testFixtureDirectory() throws URISyntaxException {
        List<SourcedRecord> records = new YamlDirectoryRecordSource(fixtureDirectory()).readRecords();

        assertEquals(List.of("abel_carter.yaml", "jane_carter.yaml", "john_carter.yaml", "julia_carter.yml"),
                records.stream().map(SourcedRecord::source).toList());
        assertTrue(records.stream().allMatch(SourcedRecord::isReadable));

        Map<String, Object> abel = records.get(0).data();
        assertTrue(abel.containsKey("bio"));
        assertNull(abel.get("bio"));

        Map<String, Object> jane = records.get(1).data();
        assertEquals("JANE001", jane.get("id"));
        assertEquals(34, jane.get("age"));
        assertEquals(Boolean.TRUE, jane.get("is_player"));
        assertEquals(List.of("steadfast", "practical"), jane.get("traits"));
        assertEquals("JOHN001", ((Map<?, ?>) jane.get("relationship_ids")).get("spouse_id"));
    }

    @Test
    @DisplayName("Should fail when the directory does not exist")
    void testMissingDirectory() {
        YamlDirectoryRecordSource source = new YamlDirectoryRecordSource(dir.resolve("missing"));

        RecordSourceException e = assertThrows(RecordSourceException.class, source::readRecords);
        assertTrue(e.getMessage().startsWith("Characters directory not found"));
    }

    @Test
    @DisplayName("Should return no records for an empty directory")
    void testEmptyDirectory() {
        assertTrue(new YamlDirectoryRecordSource(dir).readRecords().isEmpty());
    }

    @Test
    @DisplayName("Should turn unparseable files into unreadable records")
    void testUnparseableFile() throws IOException {
        Files.writeString(dir.resolve("a_good.yaml"), "id: A\nname: Al\nage: 3\ngender: M\nbio: x\n");
        Files.writeString(dir.resolve("b_bad.yaml"), "id: [unclosed\n");
        Files.writeString(dir.resolve("c_list.yml"), "- just\n- a list\n");

        List<SourcedRecord> records = new YamlDirectoryRecordSource(dir).readRecords();

        assertEquals(3, records.size());
        assertTrue(records.get(0).isReadable());
        assertFalse(records.get(1).isReadable());
        assertEquals("b_bad.yaml", records.get(1).source());
        assertTrue(records.get(1).data().isEmpty());
        assertFalse(records.get(2).isReadable());
    }

    @Test
    @DisplayName("Should describe itself by directory")
    void testDescribe() {
        assertEquals(dir.toString(), new YamlDirectoryRecordSource(dir).describe());
    }
}
