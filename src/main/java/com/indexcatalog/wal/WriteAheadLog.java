package com.indexcatalog.wal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.indexcatalog.checkpoint.CheckpointInfo;
import com.indexcatalog.checkpoint.Checkpointer;
import com.indexcatalog.core.CatalogRecord;
import com.indexcatalog.exception.DurabilityException;
import com.indexcatalog.exception.StoreException;
import com.indexcatalog.storage.RowRange;
import com.indexcatalog.storage.StoreOutcome;
import com.indexcatalog.storage.TableEntity;
import com.indexcatalog.storage.TableStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Write-Ahead Log kept in a dedicated partition of the WAL table.
 * <p>
 * Entries are append-only and never rewritten. Reads are stateless scans, so any
 * number of readers can restart from any id.
 */
public class WriteAheadLog {
    private static final Logger LOG = LoggerFactory.getLogger(WriteAheadLog.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final String WAL_PARTITION = "wal";
    static final String FIELD_OPERATION = "operation";
    static final String FIELD_PAYLOAD = "payload";

    private final TableStore walStore;
    private final Checkpointer checkpointer;
    private final WalEntryIdGenerator idGenerator;

    public WriteAheadLog(TableStore walStore) {
        this(walStore, new Checkpointer(walStore), new WalEntryIdGenerator());
    }

    public WriteAheadLog(TableStore walStore, Checkpointer checkpointer, WalEntryIdGenerator idGenerator) {
        this.walStore = walStore;
        this.checkpointer = checkpointer;
        this.idGenerator = idGenerator;
    }

    /**
     * Durably appends a mutation intent.
     *
     * @return the new entry's id
     * @throws DurabilityException if the store did not accept the entry; nothing was committed
     */
    public String append(WalOperation operation, CatalogRecord payload) throws DurabilityException {
        String entryId = idGenerator.nextId();
        Map<String, String> fields;
        try {
            fields = Map.of(
                FIELD_OPERATION, operation.tag(),
                FIELD_PAYLOAD, objectMapper.writeValueAsString(payload));
        } catch (JsonProcessingException e) {
            throw new DurabilityException("Failed to serialize WAL payload for " + entryId, e);
        }

        StoreOutcome outcome;
        try {
            outcome = walStore.create(WAL_PARTITION, entryId, fields);
        } catch (StoreException e) {
            throw new DurabilityException("Failed to append WAL entry " + entryId, e);
        }
        if (outcome != StoreOutcome.APPLIED) {
            throw new DurabilityException("WAL entry id already taken: " + entryId);
        }

        LOG.debug("WAL append: id={}, operation={}", entryId, operation.tag());
        return entryId;
    }

    /**
     * Entries with an id strictly greater than {@code entryId}, in ascending id order.
     * A {@code null} id means the beginning of the log.
     */
    public List<WalEntry> entriesAfter(String entryId) throws StoreException {
        List<TableEntity> rows = walStore.query(WAL_PARTITION, RowRange.after(entryId));
        List<WalEntry> entries = new ArrayList<>(rows.size());
        for (TableEntity row : rows) {
            entries.add(decode(row));
        }
        return entries;
    }

    /**
     * The whole log from the beginning.
     */
    public List<WalEntry> entries() throws StoreException {
        return entriesAfter(null);
    }

    /**
     * Id of the last applied entry; empty before the first recovery applied anything.
     */
    public Optional<String> getCheckpoint() throws StoreException {
        return checkpointer.load().map(CheckpointInfo::getEntryId);
    }

    /**
     * Records {@code entryId} as applied. Never moves the pointer backward.
     *
     * @return false if the checkpoint was already at or past {@code entryId}
     */
    public boolean advanceCheckpoint(String entryId) throws StoreException {
        return checkpointer.advance(entryId);
    }

    private static WalEntry decode(TableEntity row) throws StoreException {
        try {
            WalOperation operation = WalOperation.fromTag(row.getField(FIELD_OPERATION));
            CatalogRecord payload = objectMapper.readValue(row.getField(FIELD_PAYLOAD), CatalogRecord.class);
            return new WalEntry(row.getRowKey(), operation, payload);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StoreException("Corrupt WAL entry " + row.getRowKey(), e);
        }
    }
}
