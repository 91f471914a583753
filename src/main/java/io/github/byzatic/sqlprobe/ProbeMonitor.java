package io.github.byzatic.sqlprobe;

import io.github.byzatic.sqlprobe.base_exceptions.PersistenceException;
import io.github.byzatic.sqlprobe.driver.DatabaseDriver;
import io.github.byzatic.sqlprobe.driver.JdbcDatabaseDriver;
import io.github.byzatic.sqlprobe.model.DbSettings;
import io.github.byzatic.sqlprobe.model.JobDefinition;
import io.github.byzatic.sqlprobe.persistence.DbSettingsRepository;
import io.github.byzatic.sqlprobe.persistence.JobDefinitionRepository;
import io.github.byzatic.sqlprobe.persistence.JsonDbSettingsRepository;
import io.github.byzatic.sqlprobe.persistence.JsonJobDefinitionRepository;
import io.github.byzatic.sqlprobe.schedulers.JobEventListener;
import io.github.byzatic.sqlprobe.schedulers.ProbeScheduler;
import io.github.byzatic.sqlprobe.schedulers.ProbeSchedulerInterface;
import io.github.byzatic.sqlprobe.state.JobSnapshot;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Entry point for a presentation layer.
 * <p>
 * Loads job definitions and DB settings at startup, forwards user actions to the scheduler and saves
 * after every successful change. A failed save is reported as {@link PersistenceException}; the change
 * itself stays applied and running jobs are not affected.
 *
 * <pre>{@code
 * try (ProbeMonitor monitor = new ProbeMonitor.Builder().dataDirectory(Paths.get("data")).build()) {
 *     JobDefinition ping = JobDefinition.builder().name("ping").query("SELECT true").frequencySeconds(5).build();
 *     monitor.addJob(ping);
 *     monitor.setEnabled(ping.getId(), true);
 *     monitor.listJobs().forEach(s -> System.out.println(s.definition.getName() + " " + s.state.getLastStatus().displayText()));
 * }
 * }</pre>
 */
public final class ProbeMonitor implements AutoCloseable {
    private final static Logger logger = LoggerFactory.getLogger(ProbeMonitor.class);

    public static final String JOBS_FILE = "jobs.json";
    public static final String SETTINGS_FILE = "settings.json";

    private final ProbeSchedulerInterface scheduler;
    private final JobDefinitionRepository jobRepository;
    private final DbSettingsRepository settingsRepository;

    // serializes change + save so the file order matches the in-memory order
    private final Object saveLock = new Object();

    private ProbeMonitor(ProbeSchedulerInterface scheduler, JobDefinitionRepository jobRepository, DbSettingsRepository settingsRepository) {
        this.scheduler = scheduler;
        this.jobRepository = jobRepository;
        this.settingsRepository = settingsRepository;
    }

    public static final class Builder {
        private Path dataDirectory;
        private JobDefinitionRepository jobRepository;
        private DbSettingsRepository settingsRepository;
        private DatabaseDriver driver;
        private ProbeScheduler.Builder schedulerBuilder;

        /**
         * Directory holding {@value #JOBS_FILE} and {@value #SETTINGS_FILE}.
         * Ignored for a repository set explicitly.
         */
        public Builder dataDirectory(Path dataDirectory) {
            this.dataDirectory = Objects.requireNonNull(dataDirectory);
            return this;
        }

        public Builder jobRepository(JobDefinitionRepository jobRepository) {
            this.jobRepository = Objects.requireNonNull(jobRepository);
            return this;
        }

        public Builder settingsRepository(DbSettingsRepository settingsRepository) {
            this.settingsRepository = Objects.requireNonNull(settingsRepository);
            return this;
        }

        /**
         * Defaults to {@link JdbcDatabaseDriver} without timeouts.
         */
        public Builder driver(DatabaseDriver driver) {
            this.driver = Objects.requireNonNull(driver);
            return this;
        }

        /**
         * Scheduler tuning (executor, clock, listeners). Driver and settings are filled in by the monitor.
         */
        public Builder scheduler(ProbeScheduler.Builder schedulerBuilder) {
            this.schedulerBuilder = Objects.requireNonNull(schedulerBuilder);
            return this;
        }

        /**
         * Loads persisted state and starts the scheduler. All loaded jobs start disabled.
         *
         * @throws PersistenceException if stored data exists but cannot be read
         */
        public ProbeMonitor build() throws PersistenceException {
            if (jobRepository == null || settingsRepository == null) {
                Path dir = dataDirectory != null ? dataDirectory : Path.of(".");
                if (jobRepository == null) jobRepository = JsonJobDefinitionRepository.forPath(dir.resolve(JOBS_FILE));
                if (settingsRepository == null) settingsRepository = JsonDbSettingsRepository.forPath(dir.resolve(SETTINGS_FILE));
            }
            DbSettings settings = settingsRepository.load();
            List<JobDefinition> definitions = jobRepository.load();

            ProbeScheduler.Builder sb = schedulerBuilder != null ? schedulerBuilder : new ProbeScheduler.Builder();
            ProbeScheduler scheduler = sb
                    .driver(driver != null ? driver : new JdbcDatabaseDriver.Builder().build())
                    .settings(settings)
                    .build();
            try {
                for (JobDefinition d : definitions) scheduler.addJob(d);
            } catch (IllegalArgumentException e) {
                scheduler.close();
                throw new PersistenceException("Stored jobs contain a duplicate id", e);
            }
            logger.info("Probe monitor started with {} job(s)", definitions.size());
            return new ProbeMonitor(scheduler, jobRepository, settingsRepository);
        }
    }

    /**
     * Snapshot of all jobs in display order.
     */
    public List<JobSnapshot> listJobs() {
        return scheduler.listJobs();
    }

    /**
     * @throws NoSuchElementException if the job is unknown
     */
    public void setEnabled(@NotNull UUID jobId, boolean enabled) {
        boolean known = enabled ? scheduler.enable(jobId) : scheduler.disable(jobId);
        if (!known) throw new NoSuchElementException("Unknown job " + jobId);
    }

    /**
     * Adds a validated definition (see {@link JobDefinition.Builder#build()}) and saves the job list.
     *
     * @throws IllegalArgumentException if the id is in use or belonged to a removed job
     */
    public void addJob(@NotNull JobDefinition definition) throws PersistenceException {
        synchronized (saveLock) {
            scheduler.addJob(definition);
            saveJobs();
        }
    }

    /**
     * Replaces the definition with the same id and saves the job list.
     *
     * @throws NoSuchElementException if the job is unknown
     */
    public void updateJob(@NotNull JobDefinition definition) throws PersistenceException {
        synchronized (saveLock) {
            if (!scheduler.updateJob(definition)) throw new NoSuchElementException("Unknown job " + definition.getId());
            saveJobs();
        }
    }

    /**
     * @return false if the job was unknown (nothing saved)
     */
    public boolean removeJob(@NotNull UUID jobId) throws PersistenceException {
        synchronized (saveLock) {
            if (!scheduler.removeJob(jobId)) return false;
            saveJobs();
            return true;
        }
    }

    public DbSettings dbSettings() {
        return scheduler.currentSettings();
    }

    /**
     * Applies new settings to subsequent probe runs and saves them.
     */
    public void updateDbSettings(@NotNull DbSettings settings) throws PersistenceException {
        synchronized (saveLock) {
            scheduler.updateSettings(settings);
            settingsRepository.save(settings);
        }
    }

    public void addListener(JobEventListener listener) {
        scheduler.addListener(listener);
    }

    public void removeListener(JobEventListener listener) {
        scheduler.removeListener(listener);
    }

    @Override
    public void close() {
        scheduler.close();
        logger.info("Probe monitor stopped");
    }

    private void saveJobs() throws PersistenceException {
        List<JobDefinition> definitions = scheduler.listJobs().stream()
                .map(s -> s.definition)
                .collect(Collectors.toList());
        try {
            jobRepository.save(definitions);
        } catch (PersistenceException e) {
            logger.error("Saving jobs failed: {}", e.getMessage());
            throw e;
        }
    }
}
