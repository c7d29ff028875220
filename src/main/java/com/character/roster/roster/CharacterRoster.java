package com.character.roster.roster;

import com.character.roster.core.model.Entity;
import com.character.roster.loader.EntityLoader;
import com.character.roster.loader.LoadPolicy;
import com.character.roster.loader.LoadResult;
import com.character.roster.source.RecordSource;
import com.character.roster.source.RecordSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * The loaded characters of one session, handed explicitly to whatever runs the session.
 *
 * <pre>
 * CharacterRoster roster = CharacterRoster.initialize(
 *         new YamlDirectoryRecordSource(Path.of("data", "characters")),
 *         new EntityLoader(),
 *         LoadPolicy.REQUIRE_PLAYER);
 * if (!roster.isLoadAccepted()) {
 *     roster.getSessionLog().forEach(System.out::println);
 * }
 * </pre>
 */
public final class CharacterRoster {
    private static final Logger log = LoggerFactory.getLogger(CharacterRoster.class);

    private final LoadResult loadResult;
    private final boolean loadAccepted;
    private final List<String> sessionLog;

    private CharacterRoster(LoadResult loadResult, boolean loadAccepted, List<String> sessionLog) {
        this.loadResult = loadResult;
        this.loadAccepted = loadAccepted;
        this.sessionLog = List.copyOf(sessionLog);
    }

    /**
     * Loads the characters of the source and judges the outcome with the given policy.
     * An unavailable source yields an empty, rejected roster instead of an exception.
     */
    public static CharacterRoster initialize(RecordSource source, EntityLoader loader, LoadPolicy policy) {
        Objects.requireNonNull(source, "source is required");
        Objects.requireNonNull(loader, "loader is required");
        Objects.requireNonNull(policy, "policy is required");

        List<String> sessionLog = new ArrayList<>();
        LoadResult result;
        try {
            result = loader.load(source);
        } catch (RecordSourceException e) {
            sessionLog.add("ERROR: " + e.getMessage());
            sessionLog.add("CharacterRoster: Critical failure while reading character records.");
            log.error("roster.initialize_failed source={} error={}", source.describe(), e.getMessage());
            return new CharacterRoster(new LoadResult(null, null, null, null, null), false, sessionLog);
        }

        sessionLog.addAll(result.log());
        boolean accepted = policy.accepts(result);
        if (!accepted) {
            sessionLog.add("CharacterRoster: Character initialization rejected by " + policy
                    + " policy with " + result.errorCount() + " errors.");
        } else if (result.registry().isEmpty()) {
            sessionLog.add("CharacterRoster: Character initialization complete, but no characters were loaded.");
        } else {
            sessionLog.add("CharacterRoster: Loaded " + result.registry().size() + " characters.");
        }
        log.info("roster.initialized policy={} accepted={} result={}", policy, accepted, result);
        return new CharacterRoster(result, accepted, sessionLog);
    }

    /**
     * Wraps an existing load result without judging it.
     */
    public static CharacterRoster of(LoadResult result) {
        return new CharacterRoster(Objects.requireNonNull(result, "result is required"), true, result.log());
    }

    public Optional<Entity> getCharacter(String id) {
        return loadResult.getEntity(id);
    }

    public List<Entity> getAllCharacters() {
        return List.copyOf(loadResult.entities());
    }

    public Optional<Entity> getPlayerCharacter() {
        return loadResult.player();
    }

    public boolean isLoadAccepted() {
        return loadAccepted;
    }

    public LoadResult getLoadResult() {
        return loadResult;
    }

    public List<String> getSessionLog() {
        return sessionLog;
    }
}
