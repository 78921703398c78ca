package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.ExecutionLog;
import com.umitunal.cronlite.core.ExecutionLogStore;
import com.umitunal.cronlite.core.StorageException;
import com.umitunal.cronlite.serialization.JsonCodec;
import com.umitunal.cronlite.serialization.PayloadCodec;
import org.rocksdb.ReadOptions;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.Transaction;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed execution log.
 *
 * Key format: [startedAt millis (8 bytes)][log id bytes], so iteration order is
 * start order and "most recent first" is a reverse scan.
 */
public class RocksExecutionLogStore extends RocksStore implements ExecutionLogStore {
    private final PayloadCodec<ExecutionLog> codec;

    public RocksExecutionLogStore(StorageConfig config) throws RocksDBException {
        this(config, new JsonCodec<>(ExecutionLog.class));
    }

    public RocksExecutionLogStore(StorageConfig config, PayloadCodec<ExecutionLog> codec) throws RocksDBException {
        super(config.getLogsDirectory(), config);
        this.codec = codec;
    }

    @Override
    public void appendLog(ExecutionLog log) {
        try {
            transactionDB.put(writeOpts, storageKey(log), codec.encode(log));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to append execution log " + log.getId(), e);
        }
    }

    @Override
    public void updateLog(ExecutionLog log) {
        byte[] key = storageKey(log);

        try (Transaction txn = transactionDB.beginTransaction(writeOpts, txnOpts);
             ReadOptions readOpts = new ReadOptions()) {
            byte[] value = txn.getForUpdate(readOpts, key, true);

            if (value == null) {
                throw new IllegalStateException("Execution log not found: " + log.getId());
            }

            ExecutionLog stored = codec.decode(value);
            if (stored.getStatus().isTerminal()) {
                throw new IllegalStateException(
                        "Execution log " + log.getId() + " already completed as " + stored.getStatus());
            }

            txn.put(key, codec.encode(log));
            txn.commit();
        } catch (RocksDBException e) {
            throw new StorageException("Failed to update execution log " + log.getId(), e);
        }
    }

    @Override
    public List<ExecutionLog> recent(int limit) {
        return scanNewestFirst(limit, log -> true);
    }

    @Override
    public List<ExecutionLog> recentForJob(String schedulerId, int limit) {
        return scanNewestFirst(limit, log -> log.getSchedulerId().equals(schedulerId));
    }

    @Override
    public List<ExecutionLog> all() {
        List<ExecutionLog> logs = new ArrayList<>();
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seekToFirst();
            while (iter.isValid()) {
                logs.add(codec.decode(iter.value()));
                iter.next();
            }
            iter.status();
        } catch (RocksDBException e) {
            throw new StorageException("Failed to read execution logs", e);
        }
        return logs;
    }

    private List<ExecutionLog> scanNewestFirst(int limit, Predicate<ExecutionLog> filter) {
        List<ExecutionLog> logs = new ArrayList<>();
        if (limit <= 0) {
            return logs;
        }
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seekToLast();
            while (iter.isValid() && logs.size() < limit) {
                ExecutionLog log = codec.decode(iter.value());
                if (filter.test(log)) {
                    logs.add(log);
                }
                iter.prev();
            }
            iter.status();
        } catch (RocksDBException e) {
            throw new StorageException("Failed to read execution logs", e);
        }
        return logs;
    }

    /**
     * Create storage key for a log record.
     * Format: [startedAt millis (8 bytes)][log id bytes]
     */
    static byte[] storageKey(ExecutionLog log) {
        byte[] idBytes = log.getId().getBytes(UTF_8);
        ByteBuffer buffer = ByteBuffer.allocate(8 + idBytes.length);
        buffer.putLong(log.getStartedAt().toEpochMilli());
        buffer.put(idBytes);
        return buffer.array();
    }
}
