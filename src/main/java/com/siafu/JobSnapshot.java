package com.siafu;

import java.time.Instant;
import java.util.Set;

/**
 * A consistent, read-only view of a registered job taken under the scheduler's lock.
 *
 * @param runCount      occurrences that have settled, successfully or after exhausting retries
 * @param completedRuns occurrences whose handler succeeded
 * @param attempt       failed attempts of the current occurrence so far
 * @param nextRunAt     when the job is next due (while running, the occurrence being executed); null once terminal
 * @param lastError     the most recent failure reason, null if the job has never failed
 */
public record JobSnapshot(
        String name,
        String description,
        JobState state,
        long runCount,
        long completedRuns,
        int attempt,
        Instant nextRunAt,
        Instant lastRunAt,
        String lastError,
        Set<String> dependencies) {
}
