package com.indexcatalog.recovery;

import com.indexcatalog.exception.CatalogException;
import com.indexcatalog.exception.ReplayException;
import com.indexcatalog.exception.StoreException;
import com.indexcatalog.index.ApplyOutcome;
import com.indexcatalog.index.IndexPartitionWriter;
import com.indexcatalog.schema.CatalogSchema;
import com.indexcatalog.wal.WalEntry;
import com.indexcatalog.wal.WriteAheadLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Replays unapplied WAL entries against the index partitions.
 * <p>
 * Entries are applied one at a time in ascending id order and the checkpoint is
 * advanced after each one. Because insert and delete application are idempotent,
 * a pass interrupted between applying an entry and checkpointing it simply applies
 * that entry again next time. The engine keeps no state between passes, so it can
 * be invoked repeatedly and from several callers at once.
 */
public class RecoveryEngine {
    private static final Logger LOG = LoggerFactory.getLogger(RecoveryEngine.class);

    private final WriteAheadLog wal;
    private final IndexPartitionWriter indexWriter;
    private final CatalogSchema schema;

    public RecoveryEngine(WriteAheadLog wal, IndexPartitionWriter indexWriter, CatalogSchema schema) {
        this.wal = wal;
        this.indexWriter = indexWriter;
        this.schema = schema;
    }

    /**
     * Applies every entry after the current checkpoint.
     *
     * @throws ReplayException if an entry could not be applied or checkpointed; entries
     *         before it stay applied and the next pass resumes at it
     */
    public RecoveryResult recover() throws CatalogException {
        schema.requireLocked();
        String checkpoint = wal.getCheckpoint().orElse(null);
        LOG.debug("Recovery {} -> {}: checkpoint={}", RecoveryState.IDLE, RecoveryState.SCANNING,
            checkpoint != null ? checkpoint : "(none)");
        return replay(checkpoint);
    }

    /**
     * Applies every entry after {@code startAfter}, ignoring the stored checkpoint.
     * The checkpoint is still only moved forward.
     */
    public RecoveryResult recoverFrom(String startAfter) throws CatalogException {
        schema.requireLocked();
        LOG.debug("Recovery {} -> {}: explicit start after {}", RecoveryState.IDLE, RecoveryState.SCANNING,
            startAfter);
        return replay(startAfter);
    }

    private RecoveryResult replay(String startAfter) throws StoreException, ReplayException {
        List<WalEntry> pending = wal.entriesAfter(startAfter);
        if (pending.isEmpty()) {
            LOG.debug("Recovery {} -> {}: nothing to replay", RecoveryState.SCANNING, RecoveryState.IDLE);
            return new RecoveryResult(0, 0, 0, 0, null);
        }

        LOG.info("Starting WAL replay of {} entries after {}", pending.size(),
            startAfter != null ? startAfter : "(beginning)");

        int applied = 0;
        int alreadyApplied = 0;
        int notPresent = 0;
        String lastEntryId = null;

        for (WalEntry entry : pending) {
            ApplyOutcome outcome = apply(entry);
            switch (outcome) {
                case APPLIED:
                    applied++;
                    break;
                case ALREADY_APPLIED:
                    alreadyApplied++;
                    break;
                case NOT_PRESENT:
                    notPresent++;
                    break;
                default:
                    throw new IllegalStateException("Unhandled outcome " + outcome);
            }

            checkpoint(entry);
            lastEntryId = entry.getId();
        }

        RecoveryResult result = new RecoveryResult(pending.size(), applied, alreadyApplied, notPresent, lastEntryId);
        LOG.info("WAL replay completed: {}", result);
        return result;
    }

    private ApplyOutcome apply(WalEntry entry) throws ReplayException {
        LOG.debug("Recovery {}: id={}, operation={}", RecoveryState.APPLYING, entry.getId(),
            entry.getOperation().tag());
        try {
            switch (entry.getOperation()) {
                case INSERT:
                    return indexWriter.applyInsert(entry.getPayload());
                case DELETE:
                    return indexWriter.applyDelete(entry.getPayload());
                default:
                    throw new IllegalStateException("Unhandled operation " + entry.getOperation());
            }
        } catch (StoreException | IllegalArgumentException e) {
            LOG.warn("Recovery aborted at WAL entry {}: {}", entry.getId(), e.getMessage());
            throw new ReplayException(entry.getId(), "Failed to apply WAL entry " + entry.getId(), e);
        }
    }

    private void checkpoint(WalEntry entry) throws ReplayException {
        LOG.debug("Recovery {}: id={}", RecoveryState.CHECKPOINTING, entry.getId());
        try {
            wal.advanceCheckpoint(entry.getId());
        } catch (StoreException e) {
            LOG.warn("Recovery aborted checkpointing WAL entry {}: {}", entry.getId(), e.getMessage());
            throw new ReplayException(entry.getId(), "Failed to checkpoint WAL entry " + entry.getId(), e);
        }
    }
}
