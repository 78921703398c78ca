package com.umitunal.cronlite.storage;

import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.DefinitionStore;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.StorageException;
import com.umitunal.cronlite.serialization.JsonCodec;
import com.umitunal.cronlite.serialization.PayloadCodec;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;

import java.util.ArrayList;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * RocksDB-backed definition store. Key: job id (UTF-8). Value: JSON definition.
 */
public class RocksDefinitionStore extends RocksStore implements DefinitionStore {
    private final PayloadCodec<JobDefinition> codec;

    public RocksDefinitionStore(StorageConfig config) throws RocksDBException {
        this(config, new JsonCodec<>(JobDefinition.class));
    }

    public RocksDefinitionStore(StorageConfig config, PayloadCodec<JobDefinition> codec) throws RocksDBException {
        super(config.getDefinitionsDirectory(), config);
        this.codec = codec;
    }

    @Override
    public List<JobDefinition> loadAllDefinitions() {
        List<JobDefinition> definitions = new ArrayList<>();
        try (final RocksIterator iter = transactionDB.newIterator(scanReadOpts)) {
            iter.seekToFirst();
            while (iter.isValid()) {
                definitions.add(codec.decode(iter.value()));
                iter.next();
            }
            iter.status();
        } catch (RocksDBException e) {
            throw new StorageException("Failed to load job definitions", e);
        }
        return definitions;
    }

    @Override
    public void saveDefinition(JobDefinition definition) {
        try {
            transactionDB.put(writeOpts, definition.getId().getBytes(UTF_8), codec.encode(definition));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to save job " + definition.getId(), e);
        }
    }

    @Override
    public void deleteDefinition(String id) {
        try {
            transactionDB.delete(writeOpts, id.getBytes(UTF_8));
        } catch (RocksDBException e) {
            throw new StorageException("Failed to delete job " + id, e);
        }
    }
}
