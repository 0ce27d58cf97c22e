package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.model.Variable;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared working memory of the automation: read by custom conditions, written by variable_set actions and operators.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class VariableStore {

    public static final String COLLECTION = "variables";

    private final SnapshotPersistenceService snapshots;
    private final Map<String, Object> variables = new ConcurrentHashMap<>();

    @PostConstruct
    public void init() {
        for (Variable v : snapshots.register(COLLECTION, Variable.class, this::documents)) {
            if (v.getName() != null && v.getValue() != null) variables.put(v.getName(), v.getValue());
        }
    }

    public Optional<Object> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(variables.get(name));
    }

    /** Setting a null value removes the variable. */
    public void set(String name, Object value) {
        if (name == null || name.isBlank()) throw new IllegalArgumentException("Variable name is required");
        if (value == null) {
            variables.remove(name);
        } else {
            variables.put(name, value);
        }
        log.debug("Variable set name={} value={}", name, value);
        snapshots.markDirty(COLLECTION);
    }

    public boolean remove(String name) {
        boolean removed = name != null && variables.remove(name) != null;
        if (removed) snapshots.markDirty(COLLECTION);
        return removed;
    }

    public Map<String, Object> all() {
        return new TreeMap<>(variables);
    }

    public int size() {
        return variables.size();
    }

    private List<Variable> documents() {
        List<Variable> list = new ArrayList<>();
        new TreeMap<>(variables).forEach((k, v) -> list.add(new Variable(k, v)));
        return list;
    }
}
