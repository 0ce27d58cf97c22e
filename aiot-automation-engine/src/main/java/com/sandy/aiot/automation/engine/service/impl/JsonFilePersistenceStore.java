package com.sandy.aiot.automation.engine.service.impl;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sandy.aiot.automation.engine.exception.PersistenceException;
import com.sandy.aiot.automation.engine.service.PersistenceStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * One JSON document per collection under {@code automation.storage.dir}. Writes go to a temp file
 * that replaces the document in one move, so a crash never leaves a half written collection.
 */
@Service
@Profile("!test")
@Slf4j
public class JsonFilePersistenceStore implements PersistenceStore {

    private final ObjectMapper objectMapper;
    private final Path dir;

    public JsonFilePersistenceStore(ObjectMapper objectMapper,
                                    @Value("${automation.storage.dir:./data}") String storageDir) {
        this.objectMapper = objectMapper;
        this.dir = Paths.get(storageDir);
        log.info("JSON persistence store dir={}", dir.toAbsolutePath());
    }

    @Override
    public <T> List<T> loadCollection(String collection, Class<T> type) {
        Path file = file(collection);
        if (!Files.exists(file)) return new ArrayList<>();
        JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, type);
        try {
            return objectMapper.readValue(file.toFile(), listType);
        } catch (IOException e) {
            throw new PersistenceException("Cannot read collection " + collection + " from " + file, e);
        }
    }

    @Override
    public void saveCollection(String collection, List<?> documents) throws PersistenceException {
        Path file = file(collection);
        Path tmp = dir.resolve(collection + ".json.tmp");
        try {
            Files.createDirectories(dir);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), documents);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot write collection " + collection + " to " + file, e);
        }
    }

    private Path file(String collection) {
        return dir.resolve(collection + ".json");
    }
}
