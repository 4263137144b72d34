package com.indexcatalog.checkpoint;

import com.indexcatalog.exception.StoreException;
import com.indexcatalog.storage.StoreOutcome;
import com.indexcatalog.storage.TableEntity;
import com.indexcatalog.storage.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Reads and advances the checkpoint pointer kept in the WAL table.
 * <p>
 * The pointer lives in its own partition, apart from WAL entries. Advancing is a
 * compare-and-set on the pointer's etag, and a pointer already at or past the
 * requested entry is left alone, so the checkpoint never moves backward even when
 * several recoveries race.
 */
public class Checkpointer {
    private static final Logger LOG = LoggerFactory.getLogger(Checkpointer.class);

    static final String CHECKPOINT_PARTITION = "metadata";
    static final String CHECKPOINT_ROW = "checkpoint";
    static final String FIELD_ENTRY_ID = "entryId";
    static final String FIELD_UPDATED_AT = "updatedAt";
    private static final int MAX_ATTEMPTS = 64;

    private final TableStore walStore;

    public Checkpointer(TableStore walStore) {
        this.walStore = walStore;
    }

    /**
     * Loads the current checkpoint; empty before the first entry was ever applied.
     */
    public Optional<CheckpointInfo> load() throws StoreException {
        return walStore.get(CHECKPOINT_PARTITION, CHECKPOINT_ROW).map(Checkpointer::toInfo);
    }

    /**
     * Moves the checkpoint forward to {@code entryId}.
     *
     * @return true if the pointer now names {@code entryId}; false if it was already
     *         at or past it
     */
    public boolean advance(String entryId) throws StoreException {
        Map<String, String> fields = Map.of(
            FIELD_ENTRY_ID, entryId,
            FIELD_UPDATED_AT, Long.toString(System.currentTimeMillis()));

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            Optional<TableEntity> current = walStore.get(CHECKPOINT_PARTITION, CHECKPOINT_ROW);

            if (current.isEmpty()) {
                if (walStore.create(CHECKPOINT_PARTITION, CHECKPOINT_ROW, fields) == StoreOutcome.APPLIED) {
                    LOG.debug("Checkpoint created at {}", entryId);
                    return true;
                }
                continue;
            }

            String currentId = current.get().getField(FIELD_ENTRY_ID);
            if (currentId != null && currentId.compareTo(entryId) >= 0) {
                LOG.debug("Checkpoint already at {}, not moving back to {}", currentId, entryId);
                return false;
            }
            if (walStore.replace(CHECKPOINT_PARTITION, CHECKPOINT_ROW, fields, current.get().getEtag())) {
                LOG.debug("Checkpoint advanced: {} -> {}", currentId, entryId);
                return true;
            }
            LOG.debug("Checkpoint changed concurrently, retrying advance to {} (attempt {})", entryId, attempt);
        }
        throw new StoreException("Gave up advancing checkpoint to " + entryId
            + " after " + MAX_ATTEMPTS + " contended attempts");
    }

    private static CheckpointInfo toInfo(TableEntity entity) {
        String updatedAt = entity.getField(FIELD_UPDATED_AT);
        return new CheckpointInfo(
            entity.getField(FIELD_ENTRY_ID),
            updatedAt != null ? Long.parseLong(updatedAt) : entity.getTimestamp(),
            entity.getEtag());
    }
}
