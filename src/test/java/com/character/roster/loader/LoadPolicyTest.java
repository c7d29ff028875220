package com.character.roster.loader;

import com.character.roster.core.model.Entity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoadPolicyTest {

    private static final Entity JANE = Entity.builder().id("P1").name("Jane").age(30).gender("F").build();

    private static final LoadResult EMPTY = new LoadResult(Map.of(), null, List.of(), List.of(), List.of());
    private static final LoadResult NO_PLAYER = new LoadResult(Map.of("P1", JANE), null, List.of(),
            List.of(new LoadIssue(IssueType.NO_PLAYER_DESIGNATED, null, "No player")), List.of());
    private static final LoadResult WITH_DUPLICATE = new LoadResult(Map.of("P1", JANE), "P1", List.of(),
            List.of(new LoadIssue(IssueType.DUPLICATE_ID, "b.yaml", "Duplicate")), List.of());

    @ParameterizedTest
    @EnumSource(LoadPolicy.class)
    @DisplayName("Every policy accepts an empty load")
    void testEmptyAccepted(LoadPolicy policy) {
        assertTrue(policy.accepts(EMPTY));
    }

    @Test
    @DisplayName("LENIENT accepts results with errors")
    void testLenient() {
        assertTrue(LoadPolicy.LENIENT.accepts(NO_PLAYER));
        assertTrue(LoadPolicy.LENIENT.accepts(WITH_DUPLICATE));
    }

    @Test
    @DisplayName("REQUIRE_PLAYER rejects only a missing player")
    void testRequirePlayer() {
        assertFalse(LoadPolicy.REQUIRE_PLAYER.accepts(NO_PLAYER));
        assertTrue(LoadPolicy.REQUIRE_PLAYER.accepts(WITH_DUPLICATE));
    }

    @Test
    @DisplayName("STRICT rejects any error")
    void testStrict() {
        assertFalse(LoadPolicy.STRICT.accepts(NO_PLAYER));
        assertFalse(LoadPolicy.STRICT.accepts(WITH_DUPLICATE));
    }
}
