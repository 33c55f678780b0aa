package com.siafu;

import java.time.Instant;

/**
 * The settled outcome of one handler execution.
 *
 * @param runCount       the job's run count after this execution
 * @param resultingState the state the job was left in
 * @param error          the failure reason, null on success
 */
public record JobExecution(
        String jobName,
        Outcome outcome,
        long runCount,
        JobState resultingState,
        String error,
        Instant finishedAt) {

    public enum Outcome {
        /** The handler succeeded. */
        COMPLETED,
        /** The handler failed and another attempt has been scheduled. */
        RETRY_SCHEDULED,
        /** The handler failed and no retries remain. */
        FAILED
    }

    public boolean isFailure() {
        return outcome != Outcome.COMPLETED;
    }
}
