package io.github.byzatic.sqlprobe.execution;

import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.sqlprobe.base_exceptions.ProbeException;
import io.github.byzatic.sqlprobe.classifier.ResultClassifier;
import io.github.byzatic.sqlprobe.classifier.Status;
import io.github.byzatic.sqlprobe.driver.DatabaseDriver;
import io.github.byzatic.sqlprobe.driver.QueryOutcome;
import io.github.byzatic.sqlprobe.model.DbSettings;
import io.github.byzatic.sqlprobe.model.JobDefinition;
import io.github.byzatic.sqlprobe.state.JobStateStore;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs a job's probe and records the result in the {@link JobStateStore}.
 * Probe failures of any kind end up as an {@code ERROR} status and never reach the caller.
 */
@ThreadSafe
public final class JobExecutionUnit {
    private final static Logger logger = LoggerFactory.getLogger(JobExecutionUnit.class);

    private final DatabaseDriver driver;
    private final ResultClassifier classifier;
    private final JobStateStore store;
    private final Clock clock;

    public JobExecutionUnit(DatabaseDriver driver, ResultClassifier classifier, JobStateStore store, Clock clock) {
        this.driver = Objects.requireNonNull(driver);
        this.classifier = Objects.requireNonNull(classifier);
        this.store = Objects.requireNonNull(store);
        this.clock = Objects.requireNonNull(clock);
    }

    /**
     * Runs the probe and classifies it. Does not touch the store.
     */
    public @NotNull StatusUpdate execute(@NotNull JobDefinition job, @NotNull DbSettings settings) {
        Status status;
        try {
            QueryOutcome outcome = driver.run(settings, job.getQuery());
            ProbeException error = outcome.getError().orElse(null);
            status = classifier.classify(outcome.getRow().orElse(null), error);
        } catch (RuntimeException e) {
            // driver broke its contract; still only this job's problem
            logger.warn("Driver threw for job '{}'", job.getName(), e);
            status = classifier.classify(null, e);
        }
        if (status.isError()) {
            logger.warn("Job '{}' ({}) failed: {}", job.getName(), job.getId(), status.getMessage());
        } else {
            logger.debug("Job '{}' ({}) -> {}", job.getName(), job.getId(), status);
        }
        return new StatusUpdate(job.getId(), status, clock.instant());
    }

    /**
     * Executes a run whose guard the caller already claimed with {@link JobStateStore#tryBeginRun}.
     * Status, timestamp and guard release are stored together. If the guard is not held the call
     * is skipped without any state change.
     *
     * @return the recorded update, empty if skipped
     */
    public Optional<StatusUpdate> runClaimed(@NotNull JobDefinition job, @NotNull DbSettings settings) {
        if (!store.isRunning(job.getId())) {
            logger.warn("Job '{}' ({}) run requested without a claimed guard, skipping", job.getName(), job.getId());
            return Optional.empty();
        }
        boolean recorded = false;
        try {
            StatusUpdate update = execute(job, settings);
            recorded = store.finishRun(job.getId(), update.status, update.completedAt);
            return recorded ? Optional.of(update) : Optional.empty();
        } finally {
            if (!recorded) store.releaseRun(job.getId());
        }
    }
}
