package com.siafu.internal;

import com.siafu.Job;
import com.siafu.JobSnapshot;
import com.siafu.JobState;
import com.siafu.RetryPolicy;

import java.time.Instant;

/**
 * Runtime state of one registered job. Owned by the scheduler and only touched while its
 * lock is held.
 */
public class JobRecord {

    private final Job job;
    private final RetryPolicy retryPolicy;

    private JobState state = JobState.PENDING;
    private long runCount;
    private long completedRuns;
    private int attempt;
    private Instant nextRunAt;
    private Instant lastRunAt;
    private String lastError;
    private boolean lastSucceeded;
    private boolean cancelRequested;

    public JobRecord(Job job, RetryPolicy retryPolicy) {
        this.job = job;
        this.retryPolicy = retryPolicy;
    }

    public Job getJob() {
        return job;
    }

    public String getName() {
        return job.getName();
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public JobState getState() {
        return state;
    }

    public void setState(JobState state) {
        this.state = state;
    }

    public long getRunCount() {
        return runCount;
    }

    public void incrementRunCount() {
        this.runCount++;
    }

    public long getCompletedRuns() {
        return completedRuns;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getNextRunAt() {
        return nextRunAt;
    }

    public void setNextRunAt(Instant nextRunAt) {
        this.nextRunAt = nextRunAt;
    }

    public Instant getLastRunAt() {
        return lastRunAt;
    }

    public void setLastRunAt(Instant lastRunAt) {
        this.lastRunAt = lastRunAt;
    }

    public String getLastError() {
        return lastError;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    public void setCancelRequested(boolean cancelRequested) {
        this.cancelRequested = cancelRequested;
    }

    public void markSucceeded() {
        this.state = JobState.COMPLETED;
        this.completedRuns++;
        this.runCount++;
        this.attempt = 0;
        this.lastSucceeded = true;
    }

    public void markFailed(String error) {
        this.state = JobState.FAILED;
        this.lastError = error;
        this.lastSucceeded = false;
        this.attempt++;
    }

    /** Whether jobs depending on this one may run: it has succeeded before and its latest run did not fail. */
    public boolean satisfiesDependents() {
        return completedRuns > 0 && lastSucceeded;
    }

    public JobSnapshot toSnapshot() {
        return new JobSnapshot(
                job.getName(),
                job.getDescription(),
                state,
                runCount,
                completedRuns,
                attempt,
                nextRunAt,
                lastRunAt,
                lastError,
                job.getDependencies());
    }
}
