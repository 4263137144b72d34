package com.indexcatalog.exception;

/**
 * Recovery stopped at a WAL entry it could not apply. The checkpoint still points
 * at the last entry that was applied, so a later recovery resumes at {@link #getEntryId()}.
 */
public class ReplayException extends CatalogException {

    private final String entryId;

    public ReplayException(String entryId, String message, Throwable cause) {
        super(ErrorCode.REPLAY_FAILURE, message, cause);
        this.entryId = entryId;
    }

    public String getEntryId() {
        return entryId;
    }
}
