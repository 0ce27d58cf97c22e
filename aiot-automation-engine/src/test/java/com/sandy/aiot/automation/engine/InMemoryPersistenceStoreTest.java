package com.sandy.aiot.automation.engine;

import com.sandy.aiot.automation.engine.exception.PersistenceException;
import com.sandy.aiot.automation.engine.service.PersistenceStore;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

@Service
@Profile("test")
public class InMemoryPersistenceStoreTest implements PersistenceStore {
    private final Map<String, List<?>> collections = new ConcurrentHashMap<>();
    // number of upcoming saves that should fail
    private final AtomicInteger failures = new AtomicInteger();

    @Override
    @SuppressWarnings("unchecked")
    public <T> List<T> loadCollection(String collection, Class<T> type) {
        List<?> docs = collections.get(collection);
        if (docs == null) return new ArrayList<>();
        List<T> out = new ArrayList<>();
        for (Object o : docs) {
            if (type.isInstance(o)) out.add((T) o);
        }
        return out;
    }

    @Override
    public void saveCollection(String collection, List<?> documents) throws PersistenceException {
        if (failures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new PersistenceException("simulated write failure for " + collection, new IllegalStateException("disk full"));
        }
        collections.put(collection, new ArrayList<>(documents));
    }

    public void failNextSaves(int count) {
        failures.set(count);
    }

    public List<?> stored(String collection) {
        return collections.getOrDefault(collection, List.of());
    }

    public void clear() {
        collections.clear();
        failures.set(0);
    }
}
