package com.siafu.internal;

import com.siafu.ExecutionReport;
import com.siafu.JobExecution;
import com.siafu.JobState;
import com.siafu.Scheduler;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SchedulerPollerTest {

    private final Scheduler scheduler = mock(Scheduler.class);
    private final SchedulerPoller poller = new SchedulerPoller(scheduler);

    @Test
    void shouldRunPendingJobsOnEveryPoll() {
        Instant now = Instant.parse("2025-01-01T00:00:00Z");
        JobExecution failure = new JobExecution("sync", JobExecution.Outcome.FAILED, 1, JobState.EXHAUSTED, "boom", now);
        when(scheduler.runPending()).thenReturn(new ExecutionReport(now, List.of("sync"), List.of(failure), List.of()));

        poller.poll();
        poller.poll();

        verify(scheduler, times(2)).runPending();
    }

    @Test
    void shouldKeepPollingAfterUnexpectedError() {
        when(scheduler.runPending()).thenThrow(new IllegalStateException("executor shut down"));

        assertDoesNotThrow(poller::poll);
        assertDoesNotThrow(poller::poll);
        verify(scheduler, times(2)).runPending();
    }
}
