package io.github.byzatic.sqlprobe.state;

import io.github.byzatic.sqlprobe.model.JobDefinition;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Read-only view of a job for observers.
 */
public final class JobSnapshot {
    private static final DateTimeFormatter LAST_RUN_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    public final JobDefinition definition;
    public final JobRuntimeState state;

    JobSnapshot(JobDefinition definition, JobRuntimeState state) {
        this.definition = definition;
        this.state = state;
    }

    /**
     * Last run time in the given zone as {@code yyyy-MM-dd HH:mm:ss}, or an empty string if the job never ran.
     */
    public String formattedLastRun(ZoneId zone) {
        return state.getLastRunAt()
                .map(at -> LAST_RUN_FORMAT.format(at.atZone(zone)))
                .orElse("");
    }

    @Override
    public String toString() {
        return "JobSnapshot{" + definition + ", " + state + '}';
    }
}
