package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.core.ExecutionLog;
import com.umitunal.cronlite.core.ExecutionLogStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Non-durable execution log for embedding and tests. All access is serialized on
 * the instance monitor.
 */
public class InMemoryExecutionLogStore implements ExecutionLogStore {
    private static final Comparator<ExecutionLog> START_ORDER =
            Comparator.comparing(ExecutionLog::getStartedAt).thenComparing(ExecutionLog::getId);

    private final Map<String, ExecutionLog> logs = new LinkedHashMap<>();

    @Override
    public synchronized void appendLog(ExecutionLog log) {
        if (logs.containsKey(log.getId())) {
            throw new IllegalStateException("Execution log already exists: " + log.getId());
        }
        logs.put(log.getId(), log);
    }

    @Override
    public synchronized void updateLog(ExecutionLog log) {
        ExecutionLog stored = logs.get(log.getId());
        if (stored == null) {
            throw new IllegalStateException("Execution log not found: " + log.getId());
        }
        if (stored.getStatus().isTerminal()) {
            throw new IllegalStateException(
                    "Execution log " + log.getId() + " already completed as " + stored.getStatus());
        }
        logs.put(log.getId(), log);
    }

    @Override
    public synchronized List<ExecutionLog> recent(int limit) {
        return logs.values().stream()
                .sorted(START_ORDER.reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ExecutionLog> recentForJob(String schedulerId, int limit) {
        return logs.values().stream()
                .filter(log -> log.getSchedulerId().equals(schedulerId))
                .sorted(START_ORDER.reversed())
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ExecutionLog> all() {
        List<ExecutionLog> copy = new ArrayList<>(logs.values());
        copy.sort(START_ORDER);
        return copy;
    }
}
