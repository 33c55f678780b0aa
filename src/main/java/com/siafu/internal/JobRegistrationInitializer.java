package com.siafu.internal;

import com.siafu.Job;
import com.siafu.Scheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.List;

/**
 * Registers every {@link Job} bean with the scheduler on start-up. A job that cannot be
 * registered (duplicate name, dependency cycle) fails the application start.
 */
public class JobRegistrationInitializer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(JobRegistrationInitializer.class);

    private final Scheduler scheduler;
    private final List<Job> jobs;
    private volatile boolean running = false;

    public JobRegistrationInitializer(Scheduler scheduler, List<Job> jobs) {
        this.scheduler = scheduler;
        this.jobs = jobs;
    }

    @Override
    public void start() {
        log.info("Registering {} job beans with the scheduler...", jobs.size());
        for (Job job : jobs) {
            scheduler.addJob(job);
        }
        this.running = true;
    }

    @Override
    public void stop() {
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE; // Start last
    }
}
