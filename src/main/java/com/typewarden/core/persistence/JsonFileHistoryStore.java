package com.typewarden.core.persistence;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * {@link HistoryStore} backed by a single JSON array file.
 * <p>
 * The whole file is rewritten on every save through a temp file and an atomic
 * move. Load failures are logged and produce an empty list; save failures are
 * logged and leave the previous file in place.
 */
public class JsonFileHistoryStore<T> implements HistoryStore<T> {

    private static final Logger log = LoggerFactory.getLogger(JsonFileHistoryStore.class);

    private final Path file;
    private final ObjectMapper objectMapper;
    private final JavaType listType;

    public JsonFileHistoryStore(Path file, Class<T> entryType) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.listType = objectMapper.getTypeFactory().constructCollectionType(List.class, entryType);
    }

    @Override
    public List<T> load() {
        if (!Files.exists(file)) {
            log.debug("No history file at {}, starting empty", file);
            return List.of();
        }
        try {
            List<T> entries = objectMapper.readValue(file.toFile(), listType);
            if (entries == null) {
                return List.of();
            }
            log.info("Loaded {} history entries from {}", entries.size(), file);
            return entries;
        } catch (IOException e) {
            log.warn("History file {} is unreadable, starting empty: {}", file, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void save(List<T> entries) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to persist {} history entries to {}", entries.size(), file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
