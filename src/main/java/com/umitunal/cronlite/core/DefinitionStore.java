package com.umitunal.cronlite.core;

import java.util.List;

/**
 * Durable home of job definitions. The registry writes through on every mutation
 * and reads everything back once at startup.
 */
public interface DefinitionStore extends AutoCloseable {

    /**
     * Load every stored definition.
     */
    List<JobDefinition> loadAllDefinitions();

    /**
     * Insert or replace a definition keyed by its id.
     */
    void saveDefinition(JobDefinition definition);

    /**
     * Remove a definition. Removing an absent id is a no-op.
     */
    void deleteDefinition(String id);

    @Override
    default void close() {
    }
}
