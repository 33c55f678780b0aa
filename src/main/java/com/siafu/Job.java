package com.siafu;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The definition of a schedulable job. Instances are immutable and are normally created
 * with {@link JobBuilder}; runtime state (lifecycle, run count, last error) is owned by the
 * {@link Scheduler} the job is registered with and can be observed through {@link JobSnapshot}.
 */
public final class Job {

    private final String name;
    private final String description;
    private final Schedule schedule;
    private final JobHandler handler;
    private final Long maxRuns;
    private final Set<String> dependencies;
    private final RetryPolicy retryPolicy;

    Job(String name, String description, Schedule schedule, JobHandler handler, Long maxRuns,
            Set<String> dependencies, RetryPolicy retryPolicy) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description;
        this.schedule = Objects.requireNonNull(schedule, "schedule");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.maxRuns = maxRuns;
        this.dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        this.retryPolicy = retryPolicy;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public JobHandler getHandler() {
        return handler;
    }

    /**
     * The repetition cap set on this job, if any. See {@link #effectiveMaxRuns()} for the cap
     * that also accounts for one-off schedule kinds.
     */
    public Optional<Long> getMaxRuns() {
        return Optional.ofNullable(maxRuns);
    }

    public Optional<Long> effectiveMaxRuns() {
        Optional<Long> implied = schedule.impliedMaxRuns();
        if (maxRuns == null) {
            return implied;
        }
        return Optional.of(implied.map(cap -> Math.min(cap, maxRuns)).orElse(maxRuns));
    }

    /** Names of the jobs that must have completed before this one may run. */
    public Set<String> getDependencies() {
        return dependencies;
    }

    /** The retry policy chosen for this job; empty means the scheduler's default applies. */
    public Optional<RetryPolicy> getRetryPolicy() {
        return Optional.ofNullable(retryPolicy);
    }

    @Override
    public String toString() {
        return "Job[name=" + name + ", schedule=" + schedule + "]";
    }
}
