package com.indexcatalog.recovery;

import java.util.Optional;

/**
 * Summary of a completed recovery pass.
 */
public class RecoveryResult {
    private final int entriesReplayed;
    private final int applied;
    private final int alreadyApplied;
    private final int notPresent;
    private final String lastEntryId;

    RecoveryResult(int entriesReplayed, int applied, int alreadyApplied, int notPresent, String lastEntryId) {
        this.entriesReplayed = entriesReplayed;
        this.applied = applied;
        this.alreadyApplied = alreadyApplied;
        this.notPresent = notPresent;
        this.lastEntryId = lastEntryId;
    }

    public int getEntriesReplayed() { return entriesReplayed; }
    public int getApplied() { return applied; }
    public int getAlreadyApplied() { return alreadyApplied; }
    public int getNotPresent() { return notPresent; }

    /** Id of the last entry applied and checkpointed by this pass. */
    public Optional<String> getLastEntryId() { return Optional.ofNullable(lastEntryId); }

    @Override
    public String toString() {
        return String.format("RecoveryResult{replayed=%d, applied=%d, alreadyApplied=%d, notPresent=%d, last=%s}",
            entriesReplayed, applied, alreadyApplied, notPresent, lastEntryId);
    }
}
