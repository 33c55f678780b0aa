package com.siafu;

import com.siafu.config.SchedulerProperties;
import com.siafu.internal.JobRegistrationInitializer;
import com.siafu.internal.SchedulerMetrics;
import com.siafu.internal.SchedulerPoller;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.time.Clock;

@AutoConfiguration
@EnableConfigurationProperties(SchedulerProperties.class)
public class SiafuAutoConfiguration {

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public Scheduler siafuScheduler(SchedulerProperties properties, ObjectProvider<Clock> clock) {
        return new Scheduler(properties, clock.getIfAvailable(Clock::systemUTC));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobRegistrationInitializer siafuJobRegistrationInitializer(Scheduler scheduler, ObjectProvider<Job> jobs) {
        return new JobRegistrationInitializer(scheduler, jobs.orderedStream().toList());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "siafu.poll", name = "enabled", havingValue = "true")
    static class PollingConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public SchedulerPoller siafuSchedulerPoller(Scheduler scheduler) {
            return new SchedulerPoller(scheduler);
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnBean(MeterRegistry.class)
        public SchedulerMetrics siafuSchedulerMetrics(Scheduler scheduler, MeterRegistry meterRegistry) {
            return new SchedulerMetrics(scheduler, meterRegistry);
        }
    }
}
