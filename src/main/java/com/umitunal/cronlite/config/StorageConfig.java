package com.umitunal.cronlite.config;

import java.nio.file.Path;

/**
 * Configuration for the RocksDB stores holding definitions and execution logs.
 * Each store lives in its own sub-directory of the data directory.
 */
public class StorageConfig {
    public static final String DEFINITIONS_DIRECTORY = "definitions";
    public static final String LOGS_DIRECTORY = "logs";

    private final String dataDirectory;
    private final boolean durableWrites;
    private final int memoryBufferSizeMB;
    private final int maxMemoryBuffers;
    private final int backgroundThreads;
    private final long blockCacheSizeMB;

    private StorageConfig(Builder builder) {
        this.dataDirectory = builder.dataDirectory;
        this.durableWrites = builder.durableWrites;
        this.memoryBufferSizeMB = builder.memoryBufferSizeMB;
        this.maxMemoryBuffers = builder.maxMemoryBuffers;
        this.backgroundThreads = builder.backgroundThreads;
        this.blockCacheSizeMB = builder.blockCacheSizeMB;
    }

    public String getDataDirectory() { return dataDirectory; }
    public boolean isDurableWrites() { return durableWrites; }
    public int getMemoryBufferSizeMB() { return memoryBufferSizeMB; }
    public int getMaxMemoryBuffers() { return maxMemoryBuffers; }
    public int getBackgroundThreads() { return backgroundThreads; }
    public long getBlockCacheSizeMB() { return blockCacheSizeMB; }

    public String getDefinitionsDirectory() {
        return Path.of(dataDirectory, DEFINITIONS_DIRECTORY).toString();
    }

    public String getLogsDirectory() {
        return Path.of(dataDirectory, LOGS_DIRECTORY).toString();
    }

    public static Builder newBuilder(String dataDirectory) {
        return new Builder(dataDirectory);
    }

    public static class Builder {
        private final String dataDirectory;
        private boolean durableWrites = false;
        private int memoryBufferSizeMB = 16;
        private int maxMemoryBuffers = 2;
        private int backgroundThreads = 2;
        private long blockCacheSizeMB = 32;

        private Builder(String dataDirectory) {
            this.dataDirectory = dataDirectory;
        }

        /**
         * Enable durable writes (fsync on every write).
         * Slower but survives an OS crash, not only a process crash.
         * Default: false
         */
        public Builder withDurableWrites(boolean enable) {
            this.durableWrites = enable;
            return this;
        }

        /**
         * Set memtable size in MB.
         * Default: 16 MB
         */
        public Builder withMemoryBufferSize(int sizeMB) {
            this.memoryBufferSizeMB = sizeMB;
            return this;
        }

        /**
         * Default: 2
         */
        public Builder withMaxMemoryBuffers(int count) {
            this.maxMemoryBuffers = count;
            return this;
        }

        /**
         * Set number of background flush/compaction threads.
         * Default: 2
         */
        public Builder withBackgroundThreads(int count) {
            this.backgroundThreads = count;
            return this;
        }

        /**
         * Default: 32 MB per store
         */
        public Builder withBlockCacheSize(long sizeMB) {
            this.blockCacheSizeMB = sizeMB;
            return this;
        }

        public StorageConfig build() {
            return new StorageConfig(this);
        }
    }
}
