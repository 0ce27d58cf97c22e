package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.exception.PersistenceException;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Flushes in-memory collections to the {@link PersistenceStore}.
 * <p>
 * Owners register a supplier for their collection and mark it dirty after every change. A failed
 * write leaves the collection dirty, so it is retried on the next flush; memory stays authoritative.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SnapshotPersistenceService {

    private final PersistenceStore store;

    private final Map<String, Supplier<? extends List<?>>> sources = new ConcurrentHashMap<>();
    private final Set<String> dirty = ConcurrentHashMap.newKeySet();

    /**
     * Registers the owner of a collection and returns what was stored for it.
     * A collection that cannot be read starts empty.
     */
    public <T> List<T> register(String collection, Class<T> type, Supplier<? extends List<?>> source) {
        sources.put(collection, source);
        try {
            List<T> loaded = store.loadCollection(collection, type);
            log.info("Loaded collection={} size={}", collection, loaded.size());
            return loaded;
        } catch (RuntimeException e) {
            log.error("Failed to load collection={} starting empty: {}", collection, e.getMessage(), e);
            return new ArrayList<>();
        }
    }

    public void markDirty(String collection) {
        dirty.add(collection);
    }

    public boolean isDirty(String collection) {
        return dirty.contains(collection);
    }

    @Scheduled(fixedDelayString = "${automation.storage.flush-interval-ms:2000}")
    public void scheduledFlush() {
        try { flush(); } catch (Exception e) { log.error("Scheduled snapshot flush failed: {}", e.getMessage(), e); }
    }

    /**
     * Writes every dirty collection.
     *
     * @return number of collections written
     */
    public synchronized int flush() {
        int written = 0;
        for (String collection : new ArrayList<>(dirty)) {
            Supplier<? extends List<?>> source = sources.get(collection);
            dirty.remove(collection);
            if (source == null) continue;
            try {
                List<?> documents = source.get();
                store.saveCollection(collection, documents);
                written++;
                log.debug("Flushed collection={} size={}", collection, documents.size());
            } catch (PersistenceException e) {
                dirty.add(collection);
                log.error("Snapshot write failed collection={}, will retry: {}", collection, e.getMessage());
            }
        }
        return written;
    }

    @PreDestroy
    public void shutdown() {
        int written = flush();
        if (!dirty.isEmpty()) {
            log.warn("Collections still dirty at shutdown: {}", dirty);
        } else if (written > 0) {
            log.info("Flushed {} collections at shutdown", written);
        }
    }
}
