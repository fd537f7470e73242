package com.example.mlops.registry;

import com.example.mlops.exception.RegistryUnavailableException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * {@link RegistryStore} backed by a single pretty-printed JSON file.
 * Writes go to a sibling temp file which is then moved over the target.
 */
@Slf4j
public class JsonFileRegistryStore implements RegistryStore {

    private final Path path;
    private final ObjectMapper om;

    public JsonFileRegistryStore(Path path) {
        this.path = path;
        this.om = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Optional<RegistrySnapshot> load() {
        if (Files.notExists(path)) {
            log.info("No registry file at {}; starting empty", path.toAbsolutePath());
            return Optional.empty();
        }
        try {
            return Optional.of(om.readValue(path.toFile(), RegistrySnapshot.class));
        } catch (IOException e) {
            throw new RegistryUnavailableException("Cannot read model registry " + path.toAbsolutePath(), e);
        }
    }

    @Override
    public void save(RegistrySnapshot snapshot) {
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            if (path.getParent() != null) Files.createDirectories(path.getParent());
            om.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new RegistryUnavailableException("Cannot write model registry " + path.toAbsolutePath(), e);
        }
    }
}
