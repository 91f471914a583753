package io.github.byzatic.sqlprobe.state;

import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.github.byzatic.sqlprobe.classifier.Status;
import io.github.byzatic.sqlprobe.model.JobDefinition;
import org.jetbrains.annotations.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * In-memory table of jobs and their current runtime state, kept in insertion order.
 * <p>
 * All mutations happen under the store's monitor and replace the immutable {@link JobRuntimeState}
 * of exactly one job, so observers never see half of an update and a write for one job never
 * touches another.
 */
@ThreadSafe
public final class JobStateStore {

    private static final class Entry {
        final JobDefinition definition;
        final JobRuntimeState state;

        Entry(JobDefinition definition, JobRuntimeState state) {
            this.definition = definition;
            this.state = state;
        }
    }

    @GuardedBy("this")
    private final Map<UUID, Entry> entries = new LinkedHashMap<>();

    // ids of removed jobs; a late result of a removed job must never land on a new registration
    @GuardedBy("this")
    private final Set<UUID> retired = new HashSet<>();

    /**
     * Adds a job with initial state (disabled, {@code UNKNOWN}, never run).
     *
     * @throws IllegalArgumentException if a job with the same id exists or was removed before
     */
    public synchronized void register(@NotNull JobDefinition definition) {
        if (entries.containsKey(definition.getId())) {
            throw new IllegalArgumentException("Job already registered: " + definition.getId());
        }
        if (retired.contains(definition.getId())) {
            throw new IllegalArgumentException("Job id was removed and cannot be reused: " + definition.getId());
        }
        entries.put(definition.getId(), new Entry(definition, JobRuntimeState.INITIAL));
    }

    /**
     * Swaps the definition of an existing job, keeping its runtime state and position.
     */
    public synchronized boolean replaceDefinition(@NotNull JobDefinition definition) {
        Entry e = entries.get(definition.getId());
        if (e == null) return false;
        entries.put(definition.getId(), new Entry(definition, e.state));
        return true;
    }

    /**
     * Drops the job and retires its id.
     */
    public synchronized boolean remove(@NotNull UUID id) {
        if (entries.remove(id) == null) return false;
        retired.add(id);
        return true;
    }

    public synchronized void setEnabled(@NotNull UUID id, boolean enabled) {
        Entry e = entries.get(id);
        if (e == null) return;
        entries.put(id, new Entry(e.definition, e.state.withEnabled(enabled)));
    }

    /**
     * Claims the run guard of a job.
     *
     * @return true if the job exists and was idle; false if it is unknown or already running
     */
    public synchronized boolean tryBeginRun(@NotNull UUID id) {
        Entry e = entries.get(id);
        if (e == null || e.state.isRunning()) return false;
        entries.put(id, new Entry(e.definition, e.state.withRunning(true)));
        return true;
    }

    public synchronized boolean isRunning(@NotNull UUID id) {
        Entry e = entries.get(id);
        return e != null && e.state.isRunning();
    }

    /**
     * Records the outcome of a run and releases the guard in one step.
     * Ignored if the job was removed meanwhile or is not running.
     */
    public synchronized boolean finishRun(@NotNull UUID id, @NotNull Status status, @NotNull Instant completedAt) {
        Entry e = entries.get(id);
        if (e == null || !e.state.isRunning()) return false;
        entries.put(id, new Entry(e.definition, e.state.completed(status, completedAt)));
        return true;
    }

    /**
     * Releases the guard without touching status, for runs that ended without an outcome.
     */
    public synchronized void releaseRun(@NotNull UUID id) {
        Entry e = entries.get(id);
        if (e == null || !e.state.isRunning()) return;
        entries.put(id, new Entry(e.definition, e.state.withRunning(false)));
    }

    public synchronized Optional<JobDefinition> definition(@NotNull UUID id) {
        Entry e = entries.get(id);
        return e == null ? Optional.empty() : Optional.of(e.definition);
    }

    public synchronized Optional<JobSnapshot> snapshot(@NotNull UUID id) {
        Entry e = entries.get(id);
        return e == null ? Optional.empty() : Optional.of(new JobSnapshot(e.definition, e.state));
    }

    public synchronized List<JobSnapshot> list() {
        List<JobSnapshot> out = new ArrayList<>(entries.size());
        for (Entry e : entries.values()) out.add(new JobSnapshot(e.definition, e.state));
        return out;
    }
}
