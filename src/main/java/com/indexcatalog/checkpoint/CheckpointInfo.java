package com.indexcatalog.checkpoint;

/**
 * The stored checkpoint: the last WAL entry whose effects are fully applied to the index.
 */
public class CheckpointInfo {
    private final String entryId;
    private final long updatedAt;
    private final String etag;

    public CheckpointInfo(String entryId, long updatedAt, String etag) {
        this.entryId = entryId;
        this.updatedAt = updatedAt;
        this.etag = etag;
    }

    public String getEntryId() { return entryId; }
    public long getUpdatedAt() { return updatedAt; }

    /** Store concurrency token of the pointer record, used for conditional replace. */
    public String getEtag() { return etag; }

    @Override
    public String toString() {
        return String.format("CheckpointInfo{entryId=%s, updatedAt=%d}", entryId, updatedAt);
    }
}
