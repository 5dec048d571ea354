package com.incidentsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.incidentsentinel.core.model.Incident;
import com.incidentsentinel.core.spi.IncidentStore;
import com.incidentsentinel.core.spi.IncidentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Append-only incident store backed by a JSON-lines file.
 *
 * <p>
 * Each incident is written as one JSON document per line. Writers are
 * serialized with a lock; readers parse the whole file, skip lines that do
 * not parse, and return incidents newest first.
 * </p>
 */
public class JsonLinesIncidentStore implements IncidentStore {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesIncidentStore.class);

    private final Path file;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    public JsonLinesIncidentStore(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
    }

    @Override
    public void append(Incident incident) throws IncidentStoreException {
        Objects.requireNonNull(incident, "incident must not be null");
        String line;
        try {
            line = IncidentJson.toJsonLine(incident);
        } catch (JsonProcessingException e) {
            throw new IncidentStoreException("Failed to encode incident: " + e.getOriginalMessage(), e);
        }

        lock.writeLock().lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IncidentStoreException("Failed to append incident to " + file + ": " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<Incident> listAll() throws IncidentStoreException {
        List<String> lines;
        lock.readLock().lock();
        try {
            if (!Files.exists(file)) {
                return List.of();
            }
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IncidentStoreException("Failed to read incidents from " + file + ": " + e.getMessage(), e);
        } finally {
            lock.readLock().unlock();
        }

        List<Incident> incidents = new ArrayList<>(lines.size());
        int lineNo = 0;
        for (String line : lines) {
            lineNo++;
            if (line.isBlank()) {
                continue;
            }
            try {
                incidents.add(IncidentJson.fromJsonLine(line));
            } catch (JsonProcessingException e) {
                LOG.warn("Skipping malformed incident at {}:{} – {}", file, lineNo, e.getOriginalMessage());
            }
        }
        incidents.sort(Comparator.comparing(Incident::getTimestamp).reversed());
        return incidents;
    }

    public Path getFile() {
        return file;
    }
}
