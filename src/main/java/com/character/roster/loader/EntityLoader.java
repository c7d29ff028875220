package com.character.roster.loader;

import com.character.roster.core.model.Entity;
import com.character.roster.core.model.EntityValidationException;
import com.character.roster.core.model.RelationshipKind;
import com.character.roster.core.model.RelationshipLinks;
import com.character.roster.logging.LogContext;
import com.character.roster.metrics.MetricsService;
import com.character.roster.metrics.NoOpMetricsService;
import com.character.roster.source.RecordSource;
import com.character.roster.source.RecordSourceException;
import com.character.roster.source.SourcedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a batch of raw character records into a validated, linked registry.
 *
 * <p>A run goes through these steps:</p>
 * <ol>
 *   <li>Reset all state left by the previous run.</li>
 *   <li>Parse every record into an {@link Entity}; a malformed record is reported and skipped.</li>
 *   <li>Register the parsed entities in order. The first entity with a given id wins;
 *       the last entity flagged as player becomes the player.</li>
 *   <li>Report a missing player if anything was registered.</li>
 *   <li>Resolve each entity's relationship ids against the complete registry.</li>
 * </ol>
 *
 * <p>Per-record and per-relationship problems never abort the run. They are collected in the
 * returned {@link LoadResult}; whether they are fatal is up to the caller (see {@link LoadPolicy}).</p>
 *
 * <p>Instances are not thread-safe. Each run replaces the loader's state, and the returned
 * result is an independent snapshot.</p>
 */
public class EntityLoader {
    private static final Logger log = LoggerFactory.getLogger(EntityLoader.class);

    private final LoaderOptions options;
    private final MetricsService metricsService;

    private final Map<String, Entity> registry = new LinkedHashMap<>();
    private final List<String> loadLog = new ArrayList<>();
    private final List<LoadIssue> errors = new ArrayList<>();
    private final List<LoadIssue> warnings = new ArrayList<>();
    private String playerId;

    public EntityLoader() {
        this(LoaderOptions.defaults(), new NoOpMetricsService());
    }

    public EntityLoader(LoaderOptions options) {
        this(options, new NoOpMetricsService());
    }

    public EntityLoader(LoaderOptions options, MetricsService metricsService) {
        this.options = options != null ? options : LoaderOptions.defaults();
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
    }

    /**
     * Loads all records of the given source.
     *
     * @throws RecordSourceException if the source cannot be consulted; nothing is loaded in that case
     */
    public LoadResult load(RecordSource source) {
        return load(source, null);
    }

    /**
     * Loads all records of the given source, reporting progress to the callback.
     *
     * @throws RecordSourceException if the source cannot be consulted; nothing is loaded in that case
     */
    public LoadResult load(RecordSource source, ProgressCallback callback) {
        List<SourcedRecord> records;
        try {
            records = source.readRecords();
        } catch (RecordSourceException e) {
            log.error("load.source_unavailable source={} error={}", source.describe(), e.getMessage());
            throw e;
        }
        return load(records, source.describe(), callback);
    }

    /**
     * Loads the given records.
     */
    public LoadResult load(List<SourcedRecord> records) {
        return load(records, "records", null);
    }

    LoadResult load(List<SourcedRecord> records, String sourceDescription, ProgressCallback callback) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        List<SourcedRecord> batch = records != null ? records : List.of();
        long started = System.nanoTime();

        try (LogContext ctx = LogContext.forLoad(LogContext.generateLoadId(), sourceDescription)
                .with("recordCount", String.valueOf(batch.size()))) {
            reset();
            addLog("EntityLoader: Starting character load from '" + sourceDescription + "'");
            if (batch.isEmpty()) {
                addLog("WARN: No character records found in " + sourceDescription + ".");
            } else {
                addLog("EntityLoader: Found " + batch.size() + " potential character records.");
            }

            List<ParsedEntity> parsed = parseAll(batch, cb);
            register(parsed);
            addLog("EntityLoader: Successfully parsed and preliminarily processed "
                    + registry.size() + " unique characters.");

            if (!registry.isEmpty() && playerId == null) {
                addIssue(new LoadIssue(IssueType.NO_PLAYER_DESIGNATED, null,
                        "No player character (is_player: true) was designated among the loaded characters."));
            }

            linkRelationships();

            if (errors.isEmpty()) {
                addLog("EntityLoader: All characters loaded and linked successfully.");
            } else {
                addLog("EntityLoader: Character loading and linking completed with " + errors.size() + " issues.");
            }

            LoadResult result = new LoadResult(registry, playerId, loadLog, errors, warnings);
            metricsService.recordRecordsRead(batch.size());
            metricsService.recordEntitiesRegistered(registry.size());
            metricsService.recordLoadDuration(Duration.ofNanos(System.nanoTime() - started), result.hasErrors());
            cb.onProgress(batch.size(), batch.size(), "Load completed");
            log.info("load.completed result={}", result);
            return result;
        }
    }

    private void reset() {
        registry.clear();
        playerId = null;
        loadLog.clear();
        errors.clear();
        warnings.clear();
    }

    private List<ParsedEntity> parseAll(List<SourcedRecord> batch, ProgressCallback cb) {
        List<ParsedEntity> parsed = new ArrayList<>(batch.size());
        long processed = 0;
        for (SourcedRecord record : batch) {
            processed++;
            if (!record.isReadable()) {
                addIssue(new LoadIssue(IssueType.UNREADABLE_RECORD, record.source(),
                        "Failed to load character record '" + record.source() + "': " + record.readError()));
            } else {
                try {
                    parsed.add(new ParsedEntity(record.source(), Entity.fromRecord(record.data())));
                } catch (EntityValidationException e) {
                    addIssue(new LoadIssue(IssueType.VALIDATION, record.source(),
                            "Failed to load character record '" + record.source() + "': " + e.getMessage()));
                    log.warn("load.invalid_record source={} field={} error={}",
                            record.source(), e.getField(), e.getMessage());
                }
            }

            if (processed % options.getProgressInterval() == 0) {
                cb.onProgress(processed, batch.size(), "Parsed " + processed + " records");
            }
        }
        return parsed;
    }

    private void register(List<ParsedEntity> parsed) {
        for (ParsedEntity candidate : parsed) {
            Entity entity = candidate.entity();
            if (registry.containsKey(entity.getId())) {
                addIssue(new LoadIssue(IssueType.DUPLICATE_ID, candidate.source(),
                        "Duplicate character ID '" + entity.getId() + "' in '" + candidate.source()
                                + "'. Original kept, duplicate ignored."));
                continue;
            }

            registry.put(entity.getId(), entity);

            if (entity.isPlayer()) {
                if (playerId != null) {
                    addIssue(new LoadIssue(IssueType.MULTIPLE_PLAYERS, candidate.source(),
                            "Multiple player characters defined! Old: " + playerId + ", New: "
                                    + entity.getId() + ". Using the latter: " + entity.getId() + "."));
                }
                playerId = entity.getId();
            }
        }
    }

    private void linkRelationships() {
        addLog("EntityLoader: Linking character relationships...");
        if (registry.isEmpty()) {
            addLog("  No characters to link (character registry is empty).");
            return;
        }

        int resolved = 0;
        for (Entity entity : registry.values()) {
            try (LogContext ctx = LogContext.forLinking(entity.getId())) {
                Entity spouse = entity.getSpouseId()
                        .map(spouseId -> lookup(entity, RelationshipKind.SPOUSE, spouseId))
                        .orElse(null);
                List<Entity> parents = lookupAll(entity, RelationshipKind.PARENT);
                List<Entity> children = lookupAll(entity, RelationshipKind.CHILD);
                List<Entity> siblings = lookupAll(entity, RelationshipKind.SIBLING);

                entity.link(new RelationshipLinks(spouse, parents, children, siblings));
                resolved += (spouse != null ? 1 : 0) + parents.size() + children.size() + siblings.size();
            }
        }
        metricsService.incrementLinksResolved(resolved);
        addLog("EntityLoader: Character relationship linking attempt complete.");
    }

    private List<Entity> lookupAll(Entity entity, RelationshipKind kind) {
        List<Entity> found = new ArrayList<>();
        for (String id : entity.getRelationshipIds().idsFor(kind)) {
            Entity target = lookup(entity, kind, id);
            if (target != null) {
                found.add(target);
            }
        }
        return found;
    }

    private Entity lookup(Entity entity, RelationshipKind kind, String targetId) {
        Entity target = registry.get(targetId);
        if (target == null) {
            addIssue(new LoadIssue(IssueType.DANGLING_REFERENCE, entity.getId(),
                    "For character '" + entity.getId() + "', " + kind.label() + " ID '" + targetId
                            + "' not found in loaded characters."));
            log.debug("link.dangling entityId={} kind={} targetId={}", entity.getId(), kind, targetId);
        }
        return target;
    }

    private void addIssue(LoadIssue issue) {
        metricsService.incrementIssue(issue.type());
        if (!issue.type().isError()) {
            warnings.add(issue);
            if (!options.isEscalateDanglingReferences()) {
                addLog("  WARN: " + issue.message());
                return;
            }
        }
        errors.add(issue);
        addLog("ERROR: " + issue.message());
    }

    private void addLog(String message) {
        loadLog.add(message);
        log.debug("load.trace message=\"{}\"", message);
    }

    private record ParsedEntity(String source, Entity entity) {}
}
