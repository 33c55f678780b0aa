package com.siafu.internal;

import com.siafu.JobState;
import com.siafu.Scheduler;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SchedulerMetricsTest {

    private Scheduler scheduler;
    private MeterRegistry meterRegistry;
    private SchedulerMetrics schedulerMetrics;

    @BeforeEach
    void setUp() {
        scheduler = mock(Scheduler.class);
        meterRegistry = new SimpleMeterRegistry();
        schedulerMetrics = new SchedulerMetrics(scheduler, meterRegistry);
    }

    @Test
    void shouldRegisterGaugesForJobStates() {
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        counts.put(JobState.PENDING, 10L);
        counts.put(JobState.RUNNING, 2L);
        counts.put(JobState.EXHAUSTED, 5L);
        when(scheduler.countByState()).thenReturn(counts);

        schedulerMetrics.registerMetrics();

        Gauge pendingGauge = meterRegistry.find("siafu.jobs.count").tag("state", "PENDING").gauge();
        assertThat(pendingGauge).isNotNull();
        assertThat(pendingGauge.value()).isEqualTo(10.0);

        Gauge cancelledGauge = meterRegistry.find("siafu.jobs.count").tag("state", "CANCELLED").gauge();
        assertThat(cancelledGauge).isNotNull();
        assertThat(cancelledGauge.value()).isEqualTo(0.0);

        Gauge totalGauge = meterRegistry.find("siafu.jobs.total").gauge();
        assertThat(totalGauge).isNotNull();
        assertThat(totalGauge.value()).isEqualTo(17.0);

        verify(scheduler, times(1)).countByState();
    }
}
