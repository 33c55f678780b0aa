package com.siafu;

/**
 * Lifecycle of a registered job.
 *
 * <pre>
 * PENDING -> DUE -> RUNNING -> COMPLETED -> PENDING | EXHAUSTED
 *                           -> FAILED    -> PENDING | EXHAUSTED
 * any     -> CANCELLED
 * </pre>
 */
public enum JobState {
    PENDING,
    DUE,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    EXHAUSTED;

    /** Terminal states never become due again. */
    public boolean isTerminal() {
        return this == CANCELLED || this == EXHAUSTED;
    }
}
