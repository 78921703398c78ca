package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.CronFrequency;
import com.umitunal.cronlite.core.DateFrequency;
import com.umitunal.cronlite.core.IntervalFrequency;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobType;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class RocksDefinitionStoreTest {

    @TempDir
    Path tempDir;

    private StorageConfig config;
    private RocksDefinitionStore store;

    @BeforeEach
    void setUp() throws Exception {
        config = StorageConfig.newBuilder(tempDir.toString())
                .withDurableWrites(false)
                .build();
        store = new RocksDefinitionStore(config);
    }

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    private JobDefinition definition(String id, String name) {
        Instant created = Instant.parse("2023-01-01T00:00:00Z");
        return JobDefinition.newBuilder(name, JobType.DATA_BACKUP, CronFrequency.of("0 2 * * *", "Europe/Istanbul"))
                .withId(id)
                .withDescription("nightly")
                .withCreatedAt(created)
                .withUpdatedAt(created)
                .withNextRun(Instant.parse("2023-01-01T23:00:00Z"))
                .build();
    }

    @Test
    @DisplayName("Should save and load definitions of every trigger kind")
    void testSaveAndLoad() {
        // Given
        JobDefinition cron = definition("cron-1", "backup");
        JobDefinition interval = JobDefinition.newBuilder("poll", JobType.API_CALL, new IntervalFrequency(0L, 5L, 1L, 0L))
                .withId("interval-1").withActive(false).build();
        JobDefinition date = JobDefinition.newBuilder("once", JobType.EMAIL_NOTIFICATION,
                DateFrequency.at(Instant.parse("2030-05-01T10:15:30Z")))
                .withId("date-1").build();

        // When
        store.saveDefinition(cron);
        store.saveDefinition(interval);
        store.saveDefinition(date);

        // Then
        assertThat(store.loadAllDefinitions()).containsExactlyInAnyOrder(cron, interval, date);
    }

    @Test
    @DisplayName("Should overwrite a definition saved under the same id")
    void testOverwrite() {
        store.saveDefinition(definition("job-1", "before"));
        store.saveDefinition(definition("job-1", "after"));

        assertThat(store.loadAllDefinitions())
                .singleElement()
                .extracting(JobDefinition::getName)
                .isEqualTo("after");
    }

    @Test
    @DisplayName("Should delete a definition and ignore unknown ids")
    void testDelete() {
        store.saveDefinition(definition("job-1", "a"));
        store.saveDefinition(definition("job-2", "b"));

        store.deleteDefinition("job-1");
        store.deleteDefinition("never-existed");

        assertThat(store.loadAllDefinitions()).extracting(JobDefinition::getId).containsExactly("job-2");
    }

    @Test
    @DisplayName("Should keep definitions across a reopen")
    void testReopen() throws Exception {
        // Given
        JobDefinition saved = definition("job-1", "persistent");
        store.saveDefinition(saved);

        // When
        store.close();
        store = new RocksDefinitionStore(config);

        // Then
        assertThat(store.loadAllDefinitions()).containsExactly(saved);
    }
}
