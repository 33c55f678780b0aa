package com.siafu.internal;

import com.siafu.JobState;
import com.siafu.Scheduler;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

public class SchedulerMetrics {

    private static final Logger log = LoggerFactory.getLogger(SchedulerMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    private final Scheduler scheduler;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();

    private volatile Map<JobState, Long> cachedCounts = new EnumMap<>(JobState.class);
    private volatile long snapshotCapturedAtNanos = 0L;
    private volatile boolean captured = false;

    public SchedulerMetrics(Scheduler scheduler, MeterRegistry meterRegistry) {
        this.scheduler = scheduler;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void registerMetrics() {
        log.info("Micrometer found on classpath. Registering scheduler gauges...");

        for (JobState state : JobState.values()) {
            Gauge.builder("siafu.jobs.count", this, metrics -> metrics.countFor(state))
                    .description("Number of registered jobs")
                    .tag("state", state.name())
                    .register(meterRegistry);
        }

        Gauge.builder("siafu.jobs.total", this, SchedulerMetrics::totalCount)
                .description("Total number of registered jobs")
                .register(meterRegistry);
    }

    private double countFor(JobState state) {
        return getSnapshot().getOrDefault(state, 0L);
    }

    private double totalCount() {
        return getSnapshot().values().stream().mapToLong(Long::longValue).sum();
    }

    private Map<JobState, Long> getSnapshot() {
        long now = System.nanoTime();
        if (captured && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return cachedCounts;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (captured && now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedCounts;
            }
            cachedCounts = scheduler.countByState();
            snapshotCapturedAtNanos = now;
            captured = true;
            return cachedCounts;
        }
    }
}
