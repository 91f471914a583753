package io.github.byzatic.sqlprobe.execution;

import io.github.byzatic.sqlprobe.classifier.Status;

import java.time.Instant;
import java.util.UUID;

/**
 * Outcome of one probe run.
 */
public final class StatusUpdate {
    public final UUID jobId;
    public final Status status;
    public final Instant completedAt;

    public StatusUpdate(UUID jobId, Status status, Instant completedAt) {
        this.jobId = jobId;
        this.status = status;
        this.completedAt = completedAt;
    }

    @Override
    public String toString() {
        return "StatusUpdate{jobId=" + jobId + ", status=" + status + ", completedAt=" + completedAt + '}';
    }
}
