package io.github.byzatic.sqlprobe.state;

import io.github.byzatic.sqlprobe.classifier.Status;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Runtime state of one job. Immutable: every change produces a new value, so a reader always sees
 * status and timestamp from the same run.
 */
public final class JobRuntimeState {
    static final JobRuntimeState INITIAL = new JobRuntimeState(false, Status.UNKNOWN, null, false);

    private final boolean enabled;
    private final Status lastStatus;
    private final Instant lastRunAt;
    private final boolean running;

    JobRuntimeState(boolean enabled, @NotNull Status lastStatus, @Nullable Instant lastRunAt, boolean running) {
        this.enabled = enabled;
        this.lastStatus = Objects.requireNonNull(lastStatus);
        this.lastRunAt = lastRunAt;
        this.running = running;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public @NotNull Status getLastStatus() {
        return lastStatus;
    }

    /**
     * Completion time of the last run, empty if the job never ran.
     */
    public Optional<Instant> getLastRunAt() {
        return Optional.ofNullable(lastRunAt);
    }

    public boolean isRunning() {
        return running;
    }

    JobRuntimeState withEnabled(boolean enabled) {
        return new JobRuntimeState(enabled, lastStatus, lastRunAt, running);
    }

    JobRuntimeState withRunning(boolean running) {
        return new JobRuntimeState(enabled, lastStatus, lastRunAt, running);
    }

    JobRuntimeState completed(@NotNull Status status, @NotNull Instant at) {
        return new JobRuntimeState(enabled, status, at, false);
    }

    @Override
    public String toString() {
        return "JobRuntimeState{enabled=" + enabled + ", lastStatus=" + lastStatus + ", lastRunAt=" + lastRunAt + ", running=" + running + '}';
    }
}
