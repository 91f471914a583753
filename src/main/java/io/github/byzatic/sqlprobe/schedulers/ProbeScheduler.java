package io.github.byzatic.sqlprobe.schedulers;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.sqlprobe.classifier.ResultClassifier;
import io.github.byzatic.sqlprobe.classifier.Status;
import io.github.byzatic.sqlprobe.driver.DatabaseDriver;
import io.github.byzatic.sqlprobe.execution.JobExecutionUnit;
import io.github.byzatic.sqlprobe.execution.StatusUpdate;
import io.github.byzatic.sqlprobe.model.DbSettings;
import io.github.byzatic.sqlprobe.model.JobDefinition;
import io.github.byzatic.sqlprobe.state.JobSnapshot;
import io.github.byzatic.sqlprobe.state.JobStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * ProbeScheduler
 * - One fixed-rate trigger per enabled job, first fire one full interval after enabling
 * - A single dispatcher thread pops due triggers from a DelayQueue; probes run on a worker pool
 * - A trigger that finds the previous run still in flight is skipped, never queued
 * - Disabling cancels the pending trigger but lets an in-flight run finish
 * - DB settings are an atomically replaced snapshot taken when a trigger fires
 * - Event subscription (start/complete/skipped)
 */
@ThreadSafe
public final class ProbeScheduler implements ProbeSchedulerInterface {
    private final static Logger logger = LoggerFactory.getLogger(ProbeScheduler.class);

    private final ThreadPoolExecutor executor;
    private final JobStateStore store;
    private final JobExecutionUnit executionUnit;
    private final long shutdownGraceMillis;
    private final List<JobEventListener> listeners;
    private final AtomicReference<DbSettings> settings;

    private final DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
    private final Map<UUID, JobRecord> jobs = new ConcurrentHashMap<>();
    private final Thread dispatcher;
    private final AtomicBoolean running = new AtomicBoolean(true);

    private ProbeScheduler(Builder b) {
        this.executor = b.executor;
        this.store = b.store;
        this.executionUnit = new JobExecutionUnit(b.driver, new ResultClassifier(), b.store, b.clock);
        this.shutdownGraceMillis = b.shutdownGraceMillis;
        this.listeners = new CopyOnWriteArrayList<>(b.listeners);
        this.settings = new AtomicReference<>(b.settings);

        this.dispatcher = new Thread(this::dispatchLoop, "probe-dispatcher");
        this.dispatcher.setDaemon(true);
        this.dispatcher.start();
    }

    public static final class Builder {
        private ThreadPoolExecutor executor;
        private DatabaseDriver driver;
        private JobStateStore store;
        private DbSettings settings = DbSettings.empty();
        private Clock clock = Clock.systemDefaultZone();
        private long shutdownGraceMillis = 10_000; // 10s
        private final List<JobEventListener> listeners = new CopyOnWriteArrayList<>();

        /**
         * Provide your own worker pool. It must not run tasks on the caller thread,
         * otherwise a slow probe blocks the dispatcher.
         */
        public Builder executor(ThreadPoolExecutor executor) {
            this.executor = Objects.requireNonNull(executor);
            return this;
        }

        public Builder driver(DatabaseDriver driver) {
            this.driver = Objects.requireNonNull(driver);
            return this;
        }

        /**
         * Share a store with other readers. A fresh store is created if not set.
         */
        public Builder store(JobStateStore store) {
            this.store = Objects.requireNonNull(store);
            return this;
        }

        public Builder settings(DbSettings settings) {
            this.settings = Objects.requireNonNull(settings);
            return this;
        }

        /**
         * Source of run completion timestamps. Trigger times run on {@link System#nanoTime()} regardless.
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * How long close() waits for in-flight probes.
         */
        public Builder shutdownGrace(Duration grace) {
            this.shutdownGraceMillis = Objects.requireNonNull(grace).toMillis();
            return this;
        }

        public Builder addListener(JobEventListener l) {
            listeners.add(Objects.requireNonNull(l));
            return this;
        }

        public ProbeScheduler build() {
            Objects.requireNonNull(driver, "driver");
            if (store == null) store = new JobStateStore();
            if (executor == null) {
                // a thread per in-flight probe; the run guard caps it at one per job
                AtomicInteger seq = new AtomicInteger();
                executor = new ThreadPoolExecutor(
                        0, Integer.MAX_VALUE,
                        60, TimeUnit.SECONDS,
                        new SynchronousQueue<>(),
                        r -> {
                            Thread t = new Thread(r, "probe-exec-" + seq.incrementAndGet());
                            t.setDaemon(true);
                            t.setUncaughtExceptionHandler((th, ex) ->
                                    logger.error("Uncaught in {}", th.getName(), ex));
                            return t;
                        }
                );
            }
            return new ProbeScheduler(this);
        }
    }

    // ======== Public API ========

    @Override
    public void addListener(JobEventListener l) {
        listeners.add(Objects.requireNonNull(l));
    }

    @Override
    public void removeListener(JobEventListener l) {
        listeners.remove(l);
    }

    /**
     * Register a job. It starts disabled with status UNKNOWN; no trigger is armed.
     *
     * @throws IllegalArgumentException if a job with the same id is registered or was removed earlier
     */
    @Override
    public void addJob(JobDefinition definition) {
        Objects.requireNonNull(definition);
        JobRecord rec = new JobRecord(definition.getId(), intervalOf(definition));
        if (jobs.putIfAbsent(definition.getId(), rec) != null) {
            throw new IllegalArgumentException("Job already registered: " + definition.getId());
        }
        try {
            store.register(definition);
        } catch (IllegalArgumentException e) {
            jobs.remove(definition.getId(), rec);
            throw e;
        }
        logger.info("Added job '{}' ({}) every {}s", definition.getName(), definition.getId(), definition.getFrequencySeconds());
    }

    /**
     * Replace a job's definition, keeping its state. An enabled job is re-armed one new interval from now.
     */
    @Override
    public boolean updateJob(JobDefinition definition) {
        Objects.requireNonNull(definition);
        JobRecord rec = jobs.get(definition.getId());
        if (rec == null) return false;
        synchronized (rec) {
            if (!store.replaceDefinition(definition)) return false;
            rec.intervalNanos = intervalOf(definition);
            if (rec.enabled) {
                cancelPending(rec);
                arm(rec, System.nanoTime() + rec.intervalNanos);
            }
        }
        logger.info("Updated job '{}' ({})", definition.getName(), definition.getId());
        return true;
    }

    /**
     * Cancel the job's trigger and discard its state. An in-flight run finishes but its result is dropped.
     */
    @Override
    public boolean removeJob(UUID jobId) {
        JobRecord rec = jobs.remove(jobId);
        if (rec == null) return false;
        synchronized (rec) {
            rec.enabled = false;
            cancelPending(rec);
            store.remove(jobId);
        }
        logger.info("Removed job {}", jobId);
        return true;
    }

    /**
     * Start the job's trigger; first fire one full interval from now. No-op if already enabled.
     *
     * @return false if the job is unknown
     */
    @Override
    public boolean enable(UUID jobId) {
        JobRecord rec = jobs.get(jobId);
        if (rec == null) return false;
        synchronized (rec) {
            if (rec.enabled) return true;
            rec.enabled = true;
            store.setEnabled(jobId, true);
            arm(rec, System.nanoTime() + rec.intervalNanos);
        }
        logger.info("Enabled job {}", jobId);
        return true;
    }

    /**
     * Cancel the job's pending trigger. No-op if already disabled; an in-flight run is not interrupted.
     *
     * @return false if the job is unknown
     */
    @Override
    public boolean disable(UUID jobId) {
        JobRecord rec = jobs.get(jobId);
        if (rec == null) return false;
        synchronized (rec) {
            if (!rec.enabled) return true;
            rec.enabled = false;
            cancelPending(rec);
            store.setEnabled(jobId, false);
        }
        logger.info("Disabled job {}", jobId);
        return true;
    }

    /**
     * Replace the settings used by runs triggered from now on.
     */
    @Override
    public void updateSettings(DbSettings settings) {
        this.settings.set(Objects.requireNonNull(settings));
        logger.info("DB settings replaced: {}", settings);
    }

    @Override
    public DbSettings currentSettings() {
        return settings.get();
    }

    @Override
    public Optional<JobSnapshot> query(UUID jobId) {
        return store.snapshot(jobId);
    }

    /**
     * All jobs in insertion order.
     */
    @Override
    public List<JobSnapshot> listJobs() {
        return store.list();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) return;
        dispatcher.interrupt();
        queue.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGraceMillis, TimeUnit.MILLISECONDS)) {
                logger.warn("Probes still running after {} ms, interrupting", shutdownGraceMillis);
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    // ======== Internal ========

    private void dispatchLoop() {
        while (running.get()) {
            try {
                ScheduledEntry entry = queue.take(); // blocks until the earliest trigger is due
                JobRecord rec = jobs.get(entry.jobId);
                if (rec == null) continue;

                boolean skipped;
                synchronized (rec) {
                    // cancelled or superseded by a re-arm
                    if (!rec.enabled || rec.pending != entry) continue;
                    arm(rec, nextFireAfter(entry.dueAtNanos, rec.intervalNanos, System.nanoTime()));
                    skipped = !fireTrigger(rec.id);
                }
                if (skipped) fire(l -> l.onSkipped(entry.jobId));
            } catch (InterruptedException ie) {
                if (!running.get()) break;
            } catch (Throwable t) {
                logger.error("Dispatcher error", t);
            }
        }
    }

    /**
     * Fixed rate from the previous planned fire; slots already in the past are dropped, not replayed.
     */
    static long nextFireAfter(long previousFire, long interval, long now) {
        long next = previousFire + interval;
        if (next - now <= 0) {
            long missed = (now - next) / interval + 1;
            next += missed * interval;
        }
        return next;
    }

    /**
     * @return false if the previous run is still in flight and this cycle is skipped
     */
    private boolean fireTrigger(UUID jobId) {
        JobDefinition definition = store.definition(jobId).orElse(null);
        if (definition == null) return true;

        if (!store.tryBeginRun(jobId)) {
            logger.warn("Job '{}' ({}) is still running, skipping this cycle", definition.getName(), jobId);
            return false;
        }

        DbSettings snapshot = settings.get();
        try {
            executor.execute(() -> runJob(definition, snapshot));
        } catch (RejectedExecutionException e) {
            store.releaseRun(jobId);
            logger.warn("Worker pool rejected job '{}' ({})", definition.getName(), jobId);
        }
        return true;
    }

    private void runJob(JobDefinition definition, DbSettings snapshot) {
        UUID jobId = definition.getId();
        fire(l -> l.onStart(jobId));
        Optional<StatusUpdate> update = executionUnit.runClaimed(definition, snapshot);
        if (update.isPresent()) {
            Status status = update.get().status;
            fire(l -> l.onComplete(jobId, status));
        }
    }

    private void arm(JobRecord rec, long dueAtNanos) {
        ScheduledEntry entry = new ScheduledEntry(rec.id, dueAtNanos);
        rec.pending = entry;
        queue.offer(entry);
    }

    private void cancelPending(JobRecord rec) {
        if (rec.pending != null) {
            queue.remove(rec.pending);
            rec.pending = null;
        }
    }

    private static long intervalOf(JobDefinition definition) {
        return TimeUnit.SECONDS.toNanos(definition.getFrequencySeconds());
    }

    private void fire(Consumer<JobEventListener> c) {
        for (JobEventListener l : listeners) {
            try {
                c.accept(l);
            } catch (RuntimeException e) {
                logger.warn("Listener {} failed", l, e);
            }
        }
    }
}
