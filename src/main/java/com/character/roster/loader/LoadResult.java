package com.character.roster.loader;

import com.character.roster.core.model.Entity;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Result of a load run: the linked registry plus everything worth reporting about it.
 *
 * @param registry characters by id, in registration order
 * @param playerId id of the designated player character, or null if none
 * @param log      chronological trace of the run; every issue appears here too
 * @param errors   issues classified as errors, in the order they were raised
 * @param warnings issues that did not count as errors (unresolved relationship ids)
 */
public record LoadResult(
        Map<String, Entity> registry,
        String playerId,
        List<String> log,
        List<LoadIssue> errors,
        List<LoadIssue> warnings
) {
    public LoadResult {
        registry = registry != null ? Collections.unmodifiableMap(new LinkedHashMap<>(registry)) : Map.of();
        log = log != null ? List.copyOf(log) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public Optional<Entity> getEntity(String id) {
        return Optional.ofNullable(registry.get(id));
    }

    public Collection<Entity> entities() {
        return registry.values();
    }

    public Optional<Entity> player() {
        return playerId != null ? getEntity(playerId) : Optional.empty();
    }

    public boolean hasPlayer() {
        return playerId != null;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public long errorCount() {
        return errors.size();
    }

    /**
     * Returns the errors of one type, in the order they were raised.
     */
    public List<LoadIssue> errorsOfType(IssueType type) {
        return errors.stream().filter(e -> e.type() == type).toList();
    }

    @Override
    public String toString() {
        return "LoadResult{registered=" + registry.size() +
                ", player=" + playerId +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() + '}';
    }
}
