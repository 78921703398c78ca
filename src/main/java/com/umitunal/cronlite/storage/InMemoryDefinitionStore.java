package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.core.DefinitionStore;
import com.umitunal.cronlite.core.JobDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-durable definition store for embedding and tests.
 */
public class InMemoryDefinitionStore implements DefinitionStore {
    private final Map<String, JobDefinition> definitions = new ConcurrentHashMap<>();

    @Override
    public List<JobDefinition> loadAllDefinitions() {
        return new ArrayList<>(definitions.values());
    }

    @Override
    public void saveDefinition(JobDefinition definition) {
        definitions.put(definition.getId(), definition);
    }

    @Override
    public void deleteDefinition(String id) {
        definitions.remove(id);
    }
}
