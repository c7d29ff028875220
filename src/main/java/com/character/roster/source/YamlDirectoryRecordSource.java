package com.character.roster.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads one character record per YAML file from a directory.
 *
 * <p>Files ending in {@code .yaml} or {@code .yml} are read in file-name order, so
 * duplicate and player resolution is deterministic across platforms. Each record is
 * tagged with its file name.</p>
 *
 * <pre>
 * id: JANE001
 * name: Jane
 * age: 30
 * gender: F
 * bio: |
 *   Grew up on the prairie.
 * is_player: true
 * relationship_ids:
 *   spouse_id: JOHN001
 *   children_ids: [JULIA001]
 * </pre>
 */
public class YamlDirectoryRecordSource implements RecordSource {
    private static final Logger log = LoggerFactory.getLogger(YamlDirectoryRecordSource.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> RECORD_TYPE = new TypeReference<>() {};
    private static final List<String> EXTENSIONS = List.of(".yaml", ".yml");

    private final Path directory;

    public YamlDirectoryRecordSource(Path directory) {
        this.directory = directory;
    }

    @Override
    public List<SourcedRecord> readRecords() {
        if (!Files.isDirectory(directory)) {
            throw new RecordSourceException("Characters directory not found: " + directory);
        }

        List<Path> files;
        try (Stream<Path> entries = Files.list(directory)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(YamlDirectoryRecordSource::isYamlFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new RecordSourceException("Could not list characters directory: " + directory, e);
        }

        if (files.isEmpty()) {
            log.warn("source.empty directory={}", directory);
            return List.of();
        }
        log.debug("source.files directory={} count={}", directory, files.size());

        List<SourcedRecord> records = new ArrayList<>(files.size());
        for (Path file : files) {
            records.add(readFile(file));
        }
        return records;
    }

    @Override
    public String describe() {
        return directory.toString();
    }

    private SourcedRecord readFile(Path file) {
        String name = file.getFileName().toString();
        try {
            Map<String, Object> data = YAML.readValue(file.toFile(), RECORD_TYPE);
            if (data == null) {
                return SourcedRecord.unreadable(name, "File does not contain a character mapping");
            }
            return SourcedRecord.of(name, data);
        } catch (JsonProcessingException e) {
            log.warn("source.parse_failed file={} error={}", name, e.getOriginalMessage());
            return SourcedRecord.unreadable(name, "Could not parse YAML: " + e.getOriginalMessage());
        } catch (IOException e) {
            log.warn("source.read_failed file={} error={}", name, e.getMessage());
            return SourcedRecord.unreadable(name, "Could not read file: " + e.getMessage());
        }
    }

    private static boolean isYamlFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return EXTENSIONS.stream().anyMatch(name::endsWith);
    }
}
