package com.sandy.aiot.automation.engine.service;

import com.sandy.aiot.automation.engine.exception.PersistenceException;

import java.util.List;

/**
 * Durable storage for configuration collections (rules, tasks, thresholds, groups, scenes, variables).
 * Each save replaces the whole collection document.
 */
public interface PersistenceStore {
    <T> List<T> loadCollection(String collection, Class<T> type);

    void saveCollection(String collection, List<?> documents) throws PersistenceException;
}
