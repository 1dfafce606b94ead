package com.di.trialguard.lineage;

import com.di.trialguard.util.JsonSupport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Append-only JSON-lines lineage store: one event per line, one file per event type per UTC day,
 * {@code <directory>/<event_type>/<yyyy-MM-dd>.jsonl}. Files are never rewritten.
 *
 * <p>Unparsable lines are logged and skipped on read so one corrupt line cannot hide the rest of the audit
 * trail. Writes from this instance are serialized; the revision only tracks writes made through it.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "trialguard.lineage.store", havingValue = "file")
public class FileLineageEventStore implements LineageEventStore {

    static final String FILE_SUFFIX = ".jsonl";
    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final ObjectMapper objectMapper = JsonSupport.newObjectMapper();
    private final Path directory;
    private long revision;

    @Autowired
    public FileLineageEventStore(LineageProperties properties) {
        this(Paths.get(properties.getFile().getDirectory()));
    }

    public FileLineageEventStore(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create lineage directory " + directory, e);
        }
        log.info("[LINEAGE] File lineage store at {}", directory.toAbsolutePath());
    }

    @Override
    public synchronized void save(LineageEvent event) {
        if (findById(event.eventId()).isPresent()) {
            throw new IllegalArgumentException("Lineage event " + event.eventId() + " is already recorded");
        }
        Path file = fileFor(event);
        try {
            Files.createDirectories(file.getParent());
            String line = objectMapper.writeValueAsString(event) + System.lineSeparator();
            Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append lineage event " + event.eventId() + " to " + file, e);
        }
        revision++;
        log.debug("[LINEAGE] Appended event {} to {}", event.eventId(), file);
    }

    @Override
    public synchronized Optional<LineageEvent> findById(String eventId) {
        return readAll().stream().filter(e -> e.eventId().equals(eventId)).findFirst();
    }

    @Override
    public synchronized List<LineageEvent> findAll() {
        List<LineageEvent> events = readAll();
        events.sort(Comparator.comparing(LineageEvent::timestamp));
        return List.copyOf(events);
    }

    @Override
    public synchronized long revision() {
        return revision;
    }

    Path fileFor(LineageEvent event) {
        return directory.resolve(event.eventType().getTag()).resolve(DAY.format(event.timestamp()) + FILE_SUFFIX);
    }

    private List<LineageEvent> readAll() {
        List<Path> files;
        try (Stream<Path> walk = Files.walk(directory)) {
            files = walk.filter(p -> p.getFileName().toString().endsWith(FILE_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list lineage directory " + directory, e);
        }
        List<LineageEvent> events = new ArrayList<>();
        for (Path file : files) {
            readFile(file, events);
        }
        return events;
    }

    private void readFile(Path file, List<LineageEvent> into) {
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read lineage file " + file, e);
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                into.add(objectMapper.readValue(line, LineageEvent.class));
            } catch (JsonProcessingException e) {
                log.warn("[LINEAGE] Skipping unparsable line {} of {}: {}", i + 1, file, e.getOriginalMessage());
            }
        }
    }
}
