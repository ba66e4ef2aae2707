package com.accessmonitoring.infrastructure.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Snapshot stored as a single JSON document. Writes go to a sibling temp file that is
 * then moved over the target, so a reader never sees a partial document.
 */
@Slf4j
public class JsonFileSecurityStateRepository implements SecurityStateRepository {

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileSecurityStateRepository(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper.copy()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void save(SecurityStateSnapshot snapshot) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("Saved security state to {} ({} users, {} alerts, {} incidents)",
                file, snapshot.users().size(), snapshot.alerts().size(), snapshot.incidents().size());
        } catch (IOException e) {
            throw new SecurityStatePersistenceException("Failed to write security state to " + file, e);
        }
    }

    @Override
    public Optional<SecurityStateSnapshot> load() {
        if (!Files.exists(file)) {
            log.info("No security state at {}", file);
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), SecurityStateSnapshot.class));
        } catch (IOException e) {
            throw new SecurityStatePersistenceException("Failed to read security state from " + file, e);
        }
    }
}
