package io.github.byzatic.sqlprobe.schedulers;

import io.github.byzatic.sqlprobe.model.DbSettings;
import io.github.byzatic.sqlprobe.model.JobDefinition;
import io.github.byzatic.sqlprobe.state.JobSnapshot;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ProbeSchedulerInterface extends AutoCloseable {
    void addListener(JobEventListener l);

    void removeListener(JobEventListener l);

    void addJob(JobDefinition definition);

    boolean updateJob(JobDefinition definition);

    boolean removeJob(UUID jobId);

    boolean enable(UUID jobId);

    boolean disable(UUID jobId);

    void updateSettings(DbSettings settings);

    DbSettings currentSettings();

    Optional<JobSnapshot> query(UUID jobId);

    List<JobSnapshot> listJobs();

    @Override
    void close();
}
