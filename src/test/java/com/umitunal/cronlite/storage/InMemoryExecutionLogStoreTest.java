package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.core.ExecutionLog;
import com.umitunal.cronlite.core.ExecutionStatus;
import com.umitunal.cronlite.core.IntervalFrequency;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class InMemoryExecutionLogStoreTest {

    private static final Instant T0 = Instant.parse("2023-01-01T00:00:00Z");
    private static final JobDefinition JOB = JobDefinition.newBuilder("job", JobType.CUSTOM, IntervalFrequency.ofSeconds(10))
            .withId("job-1")
            .build();

    private final InMemoryExecutionLogStore store = new InMemoryExecutionLogStore();

    @Test
    @DisplayName("Should reject a duplicate append")
    void testDuplicateAppend() {
        store.appendLog(ExecutionLog.started("log-1", JOB, T0));

        assertThatThrownBy(() -> store.appendLog(ExecutionLog.started("log-1", JOB, T0)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should complete a record exactly once")
    void testSingleCompletion() {
        ExecutionLog running = ExecutionLog.started("log-1", JOB, T0);
        store.appendLog(running);
        store.updateLog(running.complete(ExecutionStatus.SUCCESS, "ok", T0.plusSeconds(2)));

        assertThatThrownBy(() -> store.updateLog(running.complete(ExecutionStatus.ERROR, "again", T0.plusSeconds(3))))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.recent(10)).singleElement()
                .satisfies(l -> {
                    assertThat(l.getStatus()).isEqualTo(ExecutionStatus.SUCCESS);
                    assertThat(l.getDuration()).isEqualTo(2.0);
                });
    }

    @Test
    @DisplayName("Should order recent logs newest first")
    void testRecent() {
        store.appendLog(ExecutionLog.started("b", JOB, T0.plusSeconds(1)));
        store.appendLog(ExecutionLog.started("a", JOB, T0));
        store.appendLog(ExecutionLog.started("c", JOB, T0.plusSeconds(2)));

        assertThat(store.recent(2)).extracting(ExecutionLog::getId).containsExactly("c", "b");
        assertThat(store.recentForJob("other", 10)).isEmpty();
        assertThat(store.all()).extracting(ExecutionLog::getId).containsExactly("a", "b", "c");
    }
}
