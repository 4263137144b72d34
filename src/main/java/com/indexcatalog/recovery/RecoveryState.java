package com.indexcatalog.recovery;

/**
 * Phases of one recovery pass.
 */
public enum RecoveryState {
    IDLE,
    SCANNING,
    APPLYING,
    CHECKPOINTING
}
