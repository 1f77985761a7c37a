package com.longevitydigest.backend.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.longevitydigest.backend.config.PipelineProperties;
import com.longevitydigest.backend.model.dto.Draft;
import com.longevitydigest.backend.model.enums.DraftStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Persists finished drafts as one JSON file each, named
 * {@code {yyyy-MM-dd}_{contentType}_{slug}.json}.
 */
@Slf4j
@Component
public class DraftStore {

    static final int MAX_SLUG_LENGTH = 20;
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final Path directory;
    private final ObjectMapper objectMapper;

    @Autowired
    public DraftStore(PipelineProperties properties) {
        this(Paths.get(properties.getStorage().getDirectory()));
    }

    public DraftStore(Path directory) {
        this.directory = directory;
        this.objectMapper = new ObjectMapper()
                .findAndRegisterModules()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Write a new file for the draft and return its path. An existing file with the
     * same name is never replaced; a numeric suffix is added instead.
     */
    public synchronized Path save(Draft draft) {
        Path file = availablePath(fileName(draft));
        write(file, draft);
        log.info("💾 Saved: {}", file.getFileName());
        return file;
    }

    /**
     * Overwrite an existing draft file
     */
    public void write(Path file, Draft draft) {
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            objectMapper.writeValue(file.toFile(), draft);
        } catch (IOException e) {
            throw new DraftStorageException("Failed to write draft " + file, e);
        }
    }

    public Draft read(Path file) {
        try {
            return objectMapper.readValue(file.toFile(), Draft.class);
        } catch (IOException e) {
            throw new DraftStorageException("Failed to read draft " + file, e);
        }
    }

    /**
     * All readable drafts, sorted by file name; unreadable files are logged and skipped
     */
    public List<StoredDraft> list() {
        List<StoredDraft> drafts = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            return drafts;
        }

        List<Path> files;
        try (Stream<Path> stream = Files.list(directory)) {
            files = stream
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new DraftStorageException("Failed to list drafts in " + directory, e);
        }

        for (Path file : files) {
            try {
                drafts.add(new StoredDraft(file, read(file)));
            } catch (DraftStorageException e) {
                log.warn("⚠️ Skipping unreadable draft {}: {}", file.getFileName(), e.getCause().getMessage());
            }
        }
        return drafts;
    }

    public List<StoredDraft> listByStatus(DraftStatus status) {
        return list().stream()
                .filter(stored -> stored.getDraft().getStatus() == status)
                .toList();
    }

    private Path availablePath(String fileName) {
        Path file = directory.resolve(fileName);
        String base = fileName.substring(0, fileName.length() - ".json".length());
        for (int suffix = 2; Files.exists(file); suffix++) {
            file = directory.resolve(base + "_" + suffix + ".json");
        }
        return file;
    }

    static String fileName(Draft draft) {
        LocalDate date = draft.getCreatedAt() != null ? draft.getCreatedAt().toLocalDate() : LocalDate.now();
        String contentType = draft.getContentType() != null ? draft.getContentType().getValue() : "draft";
        String identifier = draft.getCandidate() != null ? draft.getCandidate().getIdentifier() : null;
        return date.format(DATE) + "_" + contentType + "_" + slug(identifier) + ".json";
    }

    static String slug(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return "untitled";
        }
        String slug = identifier.replace("/", "_");
        return slug.length() > MAX_SLUG_LENGTH ? slug.substring(0, MAX_SLUG_LENGTH) : slug;
    }
}
