package com.siafu.internal;

import com.siafu.ExecutionReport;
import com.siafu.JobExecution;
import com.siafu.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives {@link Scheduler#runPending()} from Spring's task scheduler when
 * {@code siafu.poll.enabled=true}. Polls never overlap.
 */
public class SchedulerPoller {

    private static final Logger log = LoggerFactory.getLogger(SchedulerPoller.class);

    private final Scheduler scheduler;
    private final AtomicBoolean pollInProgress = new AtomicBoolean(false);

    public SchedulerPoller(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Scheduled(fixedDelayString = "#{@'siafu-com.siafu.config.SchedulerProperties'.poll.interval.toMillis()}")
    public void poll() {
        if (!pollInProgress.compareAndSet(false, true)) {
            return;
        }
        try {
            ExecutionReport report = scheduler.runPending();
            if (!report.dispatched().isEmpty()) {
                log.debug("Poll at {} dispatched {}", report.polledAt(), report.dispatched());
            }
            for (JobExecution failure : report.failures()) {
                log.warn("Job {} failed ({}): {}", failure.jobName(), failure.outcome(), failure.error());
            }
        } catch (RuntimeException e) {
            log.error("Scheduler poll failed", e);
        } finally {
            pollInProgress.set(false);
        }
    }
}
