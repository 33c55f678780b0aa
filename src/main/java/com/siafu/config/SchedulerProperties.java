package com.siafu.config;

import com.siafu.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "siafu")
public class SchedulerProperties {

    private final Worker worker = new Worker();
    private final Poll poll = new Poll();
    private final Retry retry = new Retry();

    public Worker getWorker() {
        return worker;
    }

    public Poll getPoll() {
        return poll;
    }

    public Retry getRetry() {
        return retry;
    }

    public static class Worker {
        private int count = Math.max(2, Runtime.getRuntime().availableProcessors());
        private int queueCapacity = 0;

        public int getCount() {
            return count;
        }

        public void setCount(int count) {
            this.count = count;
        }

        /**
         * Executions that may wait for a free worker. Zero or less derives a capacity from the worker count.
         */
        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int effectiveQueueCapacity() {
            return queueCapacity > 0 ? queueCapacity : Math.max(32, Math.max(1, count) * 8);
        }
    }

    public static class Poll {
        private boolean enabled = false;
        private Duration interval = Duration.ofSeconds(1);
        private Duration awaitTimeout = Duration.ofSeconds(30);

        /** Whether the Spring integration drives {@code runPending} on its own. */
        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        /** How long a poll waits for the executions it dispatched before reporting them as in flight. */
        public Duration getAwaitTimeout() {
            return awaitTimeout;
        }

        public void setAwaitTimeout(Duration awaitTimeout) {
            this.awaitTimeout = awaitTimeout;
        }
    }

    public static class Retry {
        private int defaultMaxRetries = 0;
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }

        public Duration getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(Duration initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public RetryPolicy toPolicy() {
            return RetryPolicy.exponential(defaultMaxRetries, initialBackoff, backoffMultiplier);
        }
    }
}
