package io.caretaker.core.scheduler;

import io.caretaker.core.config.ConfigException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative polling scheduler. Jobs run one after another on the thread that calls
 * {@link #run()}, in registration order, and the job table is confined to that thread once the
 * loop has started.
 *
 * <p>{@link #stop()} never interrupts a running handler. The loop notices the request at the next
 * tick boundary, so shutdown latency is bounded by the longest job plus one tick.
 */
public final class JobScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(JobScheduler.class);
    public static final Duration DEFAULT_TICK = Duration.ofSeconds(10);

    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final List<JobResultListener> listeners = new ArrayList<>();
    private final Clock clock;
    private final Ticker ticker;
    private final Duration tick;
    private final ShutdownToken shutdown;
    private volatile boolean running;

    public JobScheduler(Clock clock, Ticker ticker, Duration tick, ShutdownToken shutdown) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker must not be null");
        this.tick = Objects.requireNonNull(tick, "tick must not be null");
        this.shutdown = Objects.requireNonNull(shutdown, "shutdown must not be null");
        if (tick.isZero() || tick.isNegative()) {
            throw new ConfigException("tick must be positive, got " + tick);
        }
    }

    /**
     * Scheduler whose sleeps end early when shutdown is requested.
     */
    public static JobScheduler create(Clock clock, Duration tick, ShutdownToken shutdown) {
        return new JobScheduler(clock, shutdown::await, tick, shutdown);
    }

    public Job register(String name, Trigger trigger, JobHandler handler) {
        if (running) {
            throw new IllegalStateException("jobs cannot be registered while the scheduler is running");
        }
        if (name == null || name.isBlank()) {
            throw new ConfigException("job name must not be blank");
        }
        if (trigger == null) {
            throw new ConfigException("job '" + name + "' has no trigger");
        }
        Objects.requireNonNull(handler, "handler must not be null");
        if (jobs.containsKey(name)) {
            throw new DuplicateJobException(name);
        }

        Instant nextRun = trigger.nextRun(clock.instant(), clock.getZone());
        Job job = new Job(name, trigger, handler, nextRun);
        jobs.put(name, job);
        LOG.info("Registered job {} ({}), next run at {}", name, trigger.describe(), nextRun.atZone(clock.getZone()));
        return job;
    }

    public void addListener(JobResultListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public List<Job> jobs() {
        return List.copyOf(jobs.values());
    }

    public ShutdownToken shutdownToken() {
        return shutdown;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Runs the tick loop until shutdown is requested.
     */
    public void run() {
        if (jobs.isEmpty()) {
            LOG.warn("Scheduler started with no registered jobs");
        }
        running = true;
        LOG.info("Scheduler loop started: {} job(s), tick {}s", jobs.size(), tick.toSeconds());
        try {
            while (!shutdown.isRequested()) {
                try {
                    ticker.sleep(tick);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    shutdown.request("interrupted");
                    break;
                }
                if (shutdown.isRequested()) {
                    break;
                }
                runPending();
            }
        } finally {
            running = false;
            LOG.info("Scheduler loop stopped ({})", shutdown.reason().orElse("unknown"));
        }
    }

    /**
     * Executes every job that is due now.
     *
     * @return number of jobs executed
     */
    public int runPending() {
        Instant now = clock.instant();
        int executed = 0;
        for (Job job : List.copyOf(jobs.values())) {
            if (!job.isDue(now)) {
                continue;
            }
            if (shutdown.isRequested()) {
                LOG.info("Shutdown requested; job {} left for a later run", job.name());
                continue;
            }
            execute(job);
            executed++;
        }
        return executed;
    }

    /**
     * Executes every registered job once, due or not, in registration order. Used for one-shot
     * runs; each job's next run is still recomputed from its trigger.
     *
     * @return number of jobs executed
     */
    public int runAll() {
        int executed = 0;
        for (Job job : List.copyOf(jobs.values())) {
            if (shutdown.isRequested()) {
                LOG.info("Shutdown requested; job {} skipped", job.name());
                continue;
            }
            execute(job);
            executed++;
        }
        return executed;
    }

    public void stop() {
        if (shutdown.request("stop requested")) {
            LOG.info("Scheduler stop requested");
        }
    }

    private void execute(Job job) {
        Instant startedAt = clock.instant();
        LOG.info("Running job {}", job.name());
        JobResult result;
        try {
            result = job.handler().run();
            if (result == null) {
                result = JobResult.error("handler returned no result", clock.instant());
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable e) {
            LOG.error("Job {} failed", job.name(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            result = JobResult.error(message, clock.instant());
        }

        switch (result.status()) {
            case OK -> LOG.info("Job {} finished: ok {}", job.name(), result.detail());
            case WARNING -> LOG.warn("Job {} finished with warning: {}", job.name(), result.detail());
            case ERROR -> LOG.error("Job {} finished with error: {}", job.name(), result.detail());
        }

        Instant next = job.trigger().nextRun(startedAt, clock.getZone());
        job.completed(startedAt, result, next);
        LOG.debug("Job {} next run at {}", job.name(), next);

        for (JobResultListener listener : listeners) {
            try {
                listener.onResult(job, result, startedAt);
            } catch (RuntimeException e) {
                LOG.warn("Result listener failed for job {}: {}", job.name(), e.getMessage());
            }
        }
    }
}
