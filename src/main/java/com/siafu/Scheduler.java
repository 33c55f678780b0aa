package com.siafu;

import com.siafu.config.SchedulerProperties;
import com.siafu.internal.DependencyGraph;
import com.siafu.internal.JobRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory registry of jobs that decides when each one is due, hands due jobs to a bounded
 * pool of workers and applies the resulting state transitions.
 *
 * <p>The caller drives time: each {@link #runPending()} call selects the jobs that are due,
 * dispatches them and waits up to {@code siafu.poll.await-timeout} for their handlers.
 * Executions that take longer keep running; their outcome is applied when they finish and
 * appears in the report of the following poll. {@link #nextRun()} tells the caller how long
 * it may sleep. {@code runPending} is not re-entrant and must not be called concurrently.
 *
 * <p>The registry is guarded by a single lock that is never held while a handler runs, so
 * handlers may add or remove jobs. A job is never executed twice at the same time.
 */
public class Scheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    private static final Comparator<JobRecord> BY_NEXT_RUN = Comparator
            .comparing(JobRecord::getNextRunAt)
            .thenComparing(JobRecord::getName);

    private final Clock clock;
    private final RetryPolicy defaultRetryPolicy;
    private final Duration awaitTimeout;
    private final int capacity;
    private final ThreadPoolExecutor processingExecutor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, JobRecord> registry = new TreeMap<>();
    private final NavigableSet<JobRecord> pendingIndex = new TreeSet<>(BY_NEXT_RUN);
    private final Map<String, CompletableFuture<JobExecution>> inFlight = new LinkedHashMap<>();
    private final Queue<JobExecution> unreported = new ConcurrentLinkedQueue<>();

    public Scheduler() {
        this(new SchedulerProperties());
    }

    public Scheduler(SchedulerProperties properties) {
        this(properties, Clock.systemUTC());
    }

    public Scheduler(SchedulerProperties properties, Clock clock) {
        this.clock = clock;
        this.defaultRetryPolicy = properties.getRetry().toPolicy();
        this.awaitTimeout = properties.getPoll().getAwaitTimeout();

        int workerCount = Math.max(1, properties.getWorker().getCount());
        int queueCapacity = properties.getWorker().effectiveQueueCapacity();
        this.capacity = workerCount + queueCapacity;
        this.processingExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(queueCapacity),
                new WorkerThreadFactory(),
                new ThreadPoolExecutor.AbortPolicy());

        log.info("Scheduler started with {} workers", workerCount);
    }

    /**
     * Registers a job. Its first run is computed immediately.
     *
     * @throws SchedulingException {@link ErrorKind#DUPLICATE_JOB_ID} when the name is taken,
     *                             {@link ErrorKind#CYCLIC_DEPENDENCY} when the job would close a
     *                             dependency cycle, {@link ErrorKind#NO_FUTURE_MATCH} when its
     *                             schedule can never fire
     */
    public void addJob(Job job) {
        addJob(job, clock.instant());
    }

    /**
     * Registers a job, computing its first run as of {@code now}. Use together with
     * {@link #runPending(Instant)} when the caller drives time.
     */
    public void addJob(Job job, Instant now) {
        String name = job.getName();
        lock.lock();
        try {
            if (registry.containsKey(name)) {
                throw SchedulingException.duplicateJob(name);
            }
            Optional<List<String>> cycle = DependencyGraph.findCycle(name, job.getDependencies(), this::dependenciesOf);
            if (cycle.isPresent()) {
                throw SchedulingException.cyclicDependency(name, cycle.get());
            }

            Instant firstRun = job.getSchedule().nextRun(now, 0)
                    .orElseThrow(() -> SchedulingException.noFutureMatch("Job '" + name + "' has no run to schedule"));

            JobRecord record = new JobRecord(job, job.getRetryPolicy().orElse(defaultRetryPolicy));
            record.setNextRunAt(firstRun);
            registry.put(name, record);
            pendingIndex.add(record);
            log.info("Registered job {} with first run at {}", name, firstRun);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels a job. A job that is running is allowed to finish; it is dropped instead of
     * being re-armed once its handler returns.
     *
     * @return false if no job with that name is registered
     */
    public boolean removeJob(String name) {
        lock.lock();
        try {
            JobRecord record = registry.get(name);
            if (record == null) {
                return false;
            }
            if (record.getState() == JobState.RUNNING) {
                record.setCancelRequested(true);
                log.debug("Job {} is running; it will be cancelled when it finishes", name);
                return true;
            }
            if (record.getNextRunAt() != null) {
                pendingIndex.remove(record);
            }
            registry.remove(name);
            record.setState(JobState.CANCELLED);
            record.setNextRunAt(null);
            log.info("Cancelled job {}", name);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public ExecutionReport runPending() {
        return runPending(clock.instant());
    }

    /**
     * Dispatches every job that is due at {@code now} and whose dependencies are satisfied,
     * in job-name order, then waits for those executions up to the configured await timeout.
     * Follow-up runs and retry backoff are computed from {@code now}, not from the clock.
     */
    public ExecutionReport runPending(Instant now) {
        List<JobRecord> selected = selectDue(now);

        Map<String, CompletableFuture<JobExecution>> dispatched = new LinkedHashMap<>();
        for (JobRecord record : selected) {
            CompletableFuture<JobExecution> future = new CompletableFuture<>();
            lock.lock();
            try {
                inFlight.put(record.getName(), future);
            } finally {
                lock.unlock();
            }
            try {
                processingExecutor.execute(() -> execute(record, now, future));
                dispatched.put(record.getName(), future);
                log.debug("Dispatched job {}", record.getName());
            } catch (RejectedExecutionException saturatedWorkers) {
                log.debug("Skipping dispatch of job {} because the worker queue is saturated", record.getName());
                rearmAfterRejection(record);
            }
        }

        awaitCompletion(dispatched.values());

        List<JobExecution> executions = new ArrayList<>();
        JobExecution late;
        while ((late = unreported.poll()) != null) {
            executions.add(late);
        }
        List<String> stillRunning = new ArrayList<>();
        dispatched.forEach((name, future) -> {
            if (future.isDone()) {
                executions.add(future.join());
            } else {
                stillRunning.add(name);
                future.thenAccept(unreported::add);
            }
        });

        return new ExecutionReport(now, new ArrayList<>(dispatched.keySet()), executions, stillRunning);
    }

    /**
     * The earliest instant any registered job is next due, so callers can sleep until then.
     * Running and terminal jobs are not considered.
     */
    public Optional<Instant> nextRun() {
        lock.lock();
        try {
            return pendingIndex.isEmpty() ? Optional.empty() : Optional.of(pendingIndex.first().getNextRunAt());
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobState> jobState(String name) {
        return getJob(name).map(JobSnapshot::state);
    }

    public Optional<JobSnapshot> getJob(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(registry.get(name)).map(JobRecord::toSnapshot);
        } finally {
            lock.unlock();
        }
    }

    /** Snapshots of every registered job, ordered by name. */
    public List<JobSnapshot> listJobs() {
        lock.lock();
        try {
            return registry.values().stream().map(JobRecord::toSnapshot).toList();
        } finally {
            lock.unlock();
        }
    }

    public Map<JobState, Long> countByState() {
        Map<JobState, Long> counts = new EnumMap<>(JobState.class);
        for (JobState state : JobState.values()) {
            counts.put(state, 0L);
        }
        lock.lock();
        try {
            registry.values().forEach(record -> counts.merge(record.getState(), 1L, Long::sum));
        } finally {
            lock.unlock();
        }
        return counts;
    }

    /**
     * Waits until no execution is in flight.
     *
     * @return false if executions were still running when the timeout elapsed
     */
    public boolean awaitIdle(Duration timeout) {
        List<CompletableFuture<JobExecution>> running;
        lock.lock();
        try {
            running = new ArrayList<>(inFlight.values());
        } finally {
            lock.unlock();
        }
        awaitCompletion(running, timeout);
        return running.stream().allMatch(CompletableFuture::isDone);
    }

    @Override
    public void close() {
        log.info("Shutting down scheduler");
        processingExecutor.shutdown();
    }

    private List<JobRecord> selectDue(Instant now) {
        lock.lock();
        try {
            List<JobRecord> due = new ArrayList<>();
            for (JobRecord record : pendingIndex) {
                if (record.getNextRunAt().isAfter(now)) {
                    break;
                }
                if (dependenciesSatisfied(record)) {
                    due.add(record);
                } else {
                    log.debug("Job {} is due but waits for its dependencies {}", record.getName(),
                            record.getJob().getDependencies());
                }
            }
            due.sort(Comparator.comparing(JobRecord::getName));

            int available = capacity - inFlight.size();
            if (due.size() > available) {
                log.debug("Only {} of {} due jobs fit into the worker queue", Math.max(0, available), due.size());
                due = new ArrayList<>(due.subList(0, Math.max(0, available)));
            }
            for (JobRecord record : due) {
                pendingIndex.remove(record);
                record.setState(JobState.DUE);
                record.setState(JobState.RUNNING);
            }
            return due;
        } finally {
            lock.unlock();
        }
    }

    private boolean dependenciesSatisfied(JobRecord record) {
        for (String dependency : record.getJob().getDependencies()) {
            JobRecord prerequisite = registry.get(dependency);
            if (prerequisite == null || !prerequisite.satisfiesDependents()) {
                return false;
            }
        }
        return true;
    }

    private Set<String> dependenciesOf(String name) {
        JobRecord record = registry.get(name);
        return record == null ? Set.of() : record.getJob().getDependencies();
    }

    private void execute(JobRecord record, Instant polledAt, CompletableFuture<JobExecution> result) {
        String name = record.getName();
        try {
            record.getJob().getHandler().run();
            log.debug("Successfully completed job {}", name);
            result.complete(settle(record, polledAt, null));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Job {} was interrupted", name, e);
            result.complete(settle(record, polledAt, e));
        } catch (Exception e) {
            log.error("Failed to run job {}", name, e);
            result.complete(settle(record, polledAt, e));
        } catch (Error e) {
            log.error("Job {} raised an error", name, e);
            result.complete(settle(record, polledAt, e));
            throw e;
        }
    }

    private JobExecution settle(JobRecord record, Instant polledAt, Throwable failure) {
        Instant finishedAt = clock.instant();
        String name = record.getName();

        lock.lock();
        try {
            inFlight.remove(name);
            record.setLastRunAt(polledAt);
            JobExecution.Outcome outcome;
            String error = null;

            if (failure == null) {
                record.markSucceeded();
                outcome = JobExecution.Outcome.COMPLETED;
            } else {
                error = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
                record.markFailed(error);
                outcome = JobExecution.Outcome.FAILED;
            }

            if (record.isCancelRequested()) {
                registry.remove(name);
                record.setState(JobState.CANCELLED);
                record.setNextRunAt(null);
                log.info("Cancelled job {} after its running execution finished", name);
            } else if (failure == null) {
                rearm(record, polledAt);
            } else if (record.getRetryPolicy().allowsRetry(record.getAttempt())) {
                Duration backoff = record.getRetryPolicy().backoffFor(record.getAttempt());
                record.setState(JobState.PENDING);
                record.setNextRunAt(polledAt.plus(backoff));
                pendingIndex.add(record);
                outcome = JobExecution.Outcome.RETRY_SCHEDULED;
                log.debug("Retry {} of job {} scheduled at {}", record.getAttempt(), name, record.getNextRunAt());
            } else {
                record.incrementRunCount();
                record.setState(JobState.EXHAUSTED);
                record.setNextRunAt(null);
                log.warn("Job {} failed after {} attempts and will not run again: {}", name, record.getAttempt(), error);
            }

            return new JobExecution(name, outcome, record.getRunCount(), record.getState(), error, finishedAt);
        } finally {
            lock.unlock();
        }
    }

    private void rearm(JobRecord record, Instant polledAt) {
        Optional<Long> maxRuns = record.getJob().effectiveMaxRuns();
        Optional<Instant> next = Optional.empty();
        if (maxRuns.isEmpty() || record.getRunCount() < maxRuns.get()) {
            try {
                next = record.getJob().getSchedule().nextRun(polledAt, record.getRunCount());
            } catch (SchedulingException noFutureMatch) {
                log.debug("Job {} has no further runs: {}", record.getName(), noFutureMatch.getMessage());
            }
        }

        if (next.isPresent()) {
            record.setState(JobState.PENDING);
            record.setNextRunAt(next.get());
            pendingIndex.add(record);
            log.debug("Job {} re-armed for {}", record.getName(), next.get());
        } else {
            record.setState(JobState.EXHAUSTED);
            record.setNextRunAt(null);
            log.info("Job {} is exhausted after {} runs", record.getName(), record.getRunCount());
        }
    }

    private void rearmAfterRejection(JobRecord record) {
        lock.lock();
        try {
            inFlight.remove(record.getName());
            if (record.isCancelRequested()) {
                registry.remove(record.getName());
                record.setState(JobState.CANCELLED);
                return;
            }
            record.setState(JobState.PENDING);
            pendingIndex.add(record);
        } finally {
            lock.unlock();
        }
    }

    private void awaitCompletion(Collection<CompletableFuture<JobExecution>> futures) {
        awaitCompletion(futures, awaitTimeout);
    }

    private void awaitCompletion(Collection<CompletableFuture<JobExecution>> futures, Duration timeout) {
        if (futures.isEmpty()) {
            return;
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Stopped waiting for {} executions after {}", futures.size(), timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.debug("An execution ended abnormally", e.getCause());
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "siafu-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
