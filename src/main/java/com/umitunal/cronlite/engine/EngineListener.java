package com.umitunal.cronlite.engine;

import com.umitunal.cronlite.core.EngineFatalException;
import com.umitunal.cronlite.core.ExecutionLog;

/**
 * Callbacks from the execution engine. Invoked on engine threads; keep them short.
 */
public interface EngineListener {

    /**
     * The engine stopped dispatching because of an infrastructure failure.
     */
    void onFatal(EngineFatalException error);

    default void onExecutionCompleted(ExecutionLog log) {
    }

    EngineListener NONE = error -> { };
}
