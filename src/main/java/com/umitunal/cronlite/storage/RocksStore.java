package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.StorageException;
import org.rocksdb.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared RocksDB setup for the scheduler's stores. Each store owns one database
 * opened as an OptimisticTransactionDB so read-modify-write updates are atomic.
 */
abstract class RocksStore implements AutoCloseable {
    protected final OptimisticTransactionDB transactionDB;
    protected final WriteOptions writeOpts;
    protected final OptimisticTransactionOptions txnOpts;
    protected final ReadOptions scanReadOpts;
    private final Options dbOptions;
    private final BlockBasedTableConfig tableConfig;
    private final Cache blockCache;
    private final Filter bloomFilter;

    protected RocksStore(String directory, StorageConfig config) throws RocksDBException {
        RocksDB.loadLibrary();

        try {
            Files.createDirectories(Path.of(directory));
        } catch (IOException e) {
            throw new StorageException("Cannot create storage directory " + directory, e);
        }

        this.blockCache = new LRUCache(config.getBlockCacheSizeMB() * 1024 * 1024);
        this.bloomFilter = new BloomFilter(10, false); // 10 bits per key

        this.tableConfig = new BlockBasedTableConfig()
                .setBlockCache(blockCache)
                .setFilterPolicy(bloomFilter)
                .setCacheIndexAndFilterBlocks(true)
                .setPinL0FilterAndIndexBlocksInCache(true);

        this.dbOptions = new Options()
                .setCreateIfMissing(true)
                .setCompressionType(CompressionType.LZ4_COMPRESSION)
                .setWriteBufferSize((long) config.getMemoryBufferSizeMB() * 1024 * 1024)
                .setMaxWriteBufferNumber(config.getMaxMemoryBuffers())
                .setMaxBackgroundJobs(config.getBackgroundThreads())
                .setAllowConcurrentMemtableWrite(true)
                .setEnableWriteThreadAdaptiveYield(true)
                .setTableFormatConfig(tableConfig)
                .setMaxOpenFiles(-1);

        this.transactionDB = OptimisticTransactionDB.open(dbOptions, directory);

        // WAL stays on: schedule state must survive a process crash
        this.writeOpts = new WriteOptions()
                .setSync(config.isDurableWrites());

        this.txnOpts = new OptimisticTransactionOptions()
                .setSetSnapshot(true);

        // Scans must not evict hot point-lookup blocks
        this.scanReadOpts = new ReadOptions()
                .setFillCache(false);
    }

    @Override
    public void close() {
        if (scanReadOpts != null) {
            scanReadOpts.close();
        }
        if (txnOpts != null) {
            txnOpts.close();
        }
        if (writeOpts != null) {
            writeOpts.close();
        }
        if (transactionDB != null) {
            transactionDB.close();
        }
        if (dbOptions != null) {
            dbOptions.close();
        }
        // BlockBasedTableConfig is released together with Options
        if (blockCache != null) {
            blockCache.close();
        }
        if (bloomFilter != null) {
            bloomFilter.close();
        }
    }
}
