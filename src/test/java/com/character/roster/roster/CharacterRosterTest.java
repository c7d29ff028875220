package com.character.roster.roster;

import com.character.roster.core.model.Entity;
import com.character.roster.loader.EntityLoader;
import com.character.roster.loader.LoadPolicy;
import com.character.roster.source.InMemoryRecordSource;
import com.character.roster.source.RecordSource;
import com.character.roster.source.RecordSourceException;
import com.character.roster.source.YamlDirectoryRecordSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CharacterRosterTest {

    @Mock
    private RecordSource failingSource;

    private static Path fixtureDirectory() throws URISyntaxException {
        return Path.of(CharacterRosterTest.class.getResource("/characters").toURI());
    }

    @Test
    @DisplayName("Should load and link the fixture family")
    void testFixtureFamily() throws URISyntaxException {
        CharacterRoster roster = CharacterRoster.initialize(
                new YamlDirectoryRecordSource(fixtureDirectory()), new EntityLoader(), LoadPolicy.STRICT);

        assertTrue(roster.isLoadAccepted());
        assertEquals(4, roster.getAllCharacters().size());

        Entity jane = roster.getPlayerCharacter().orElseThrow();
        Entity john = roster.getCharacter("JOHN001").orElseThrow();
        Entity julia = roster.getCharacter("JULIA001").orElseThrow();
        Entity abel = roster.getCharacter("ABEL001").orElseThrow();
        assertEquals("JANE001", jane.getId());
        assertSame(john, jane.getSpouse().orElseThrow());
        assertSame(jane, john.getSpouse().orElseThrow());
        assertEquals(List.of(jane, john), julia.getParents());
        assertEquals(List.of(julia), john.getChildren());
        assertEquals(List.of(abel), john.getSiblings());
        assertEquals(List.of(john), abel.getSiblings());
        assertEquals("", abel.getBio());
        assertTrue(abel.getFullBioDisplay().contains("Bio:\n  N/A"));
        assertEquals("Julia Carter (6F)", julia.getShortDescription());

        assertTrue(roster.getLoadResult().warnings().isEmpty());
        assertTrue(roster.getSessionLog().contains("CharacterRoster: Loaded 4 characters."));
    }

    @Test
    @DisplayName("Should reject a load without a player under REQUIRE_PLAYER")
    void testRequirePlayerRejects() {
        RecordSource source = InMemoryRecordSource.of(List.of(
                Map.of("id", "A", "name", "Al", "age", 40, "gender", "M", "bio", "")));

        CharacterRoster roster = CharacterRoster.initialize(source, new EntityLoader(), LoadPolicy.REQUIRE_PLAYER);

        assertFalse(roster.isLoadAccepted());
        assertTrue(roster.getPlayerCharacter().isEmpty());
        assertTrue(roster.getCharacter("A").isPresent());
        assertTrue(roster.getSessionLog().get(roster.getSessionLog().size() - 1)
                .startsWith("CharacterRoster: Character initialization rejected by REQUIRE_PLAYER"));
    }

    @Test
    @DisplayName("Should produce an empty rejected roster when the source is unavailable")
    void testSourceUnavailable() {
        when(failingSource.readRecords()).thenThrow(new RecordSourceException("Characters directory not found: x"));
        when(failingSource.describe()).thenReturn("x");

        CharacterRoster roster = CharacterRoster.initialize(failingSource, new EntityLoader(), LoadPolicy.LENIENT);

        assertFalse(roster.isLoadAccepted());
        assertTrue(roster.getAllCharacters().isEmpty());
        assertEquals("ERROR: Characters directory not found: x", roster.getSessionLog().get(0));
    }

    @Test
    @DisplayName("Should note an empty but accepted load")
    void testEmptyLoad() {
        CharacterRoster roster = CharacterRoster.initialize(
                InMemoryRecordSource.of(List.of()), new EntityLoader(), LoadPolicy.REQUIRE_PLAYER);

        assertTrue(roster.isLoadAccepted());
        assertTrue(roster.getSessionLog().contains(
                "CharacterRoster: Character initialization complete, but no characters were loaded."));
    }
}
