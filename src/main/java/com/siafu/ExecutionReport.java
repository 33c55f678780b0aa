package com.siafu;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * What a single {@link Scheduler#runPending} call did.
 *
 * @param polledAt   the instant the poll evaluated due-ness against
 * @param dispatched names of the jobs handed to workers by this poll, in dispatch order
 * @param executions executions that settled since the previous report, including slow ones
 *                   dispatched by earlier polls
 * @param inFlight   jobs dispatched by this poll that were still running when it stopped waiting
 */
public record ExecutionReport(
        Instant polledAt,
        List<String> dispatched,
        List<JobExecution> executions,
        List<String> inFlight) {

    public ExecutionReport {
        dispatched = List.copyOf(dispatched);
        executions = List.copyOf(executions);
        inFlight = List.copyOf(inFlight);
    }

    public List<JobExecution> failures() {
        return executions.stream().filter(JobExecution::isFailure).toList();
    }

    public boolean hasFailures() {
        return executions.stream().anyMatch(JobExecution::isFailure);
    }

    public Optional<JobExecution> executionOf(String jobName) {
        return executions.stream().filter(execution -> execution.jobName().equals(jobName)).findFirst();
    }
}
