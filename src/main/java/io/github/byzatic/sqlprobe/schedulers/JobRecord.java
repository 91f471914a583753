package io.github.byzatic.sqlprobe.schedulers;

import com.google.errorprone.annotations.concurrent.GuardedBy;

import java.util.UUID;

/**
 * Trigger bookkeeping of one job. Lifecycle changes and trigger fires synchronize on the record.
 */
final class JobRecord {
    final UUID id;

    @GuardedBy("this")
    boolean enabled = false;

    @GuardedBy("this")
    long intervalNanos;

    @GuardedBy("this")
    ScheduledEntry pending = null;

    JobRecord(UUID id, long intervalNanos) {
        this.id = id;
        this.intervalNanos = intervalNanos;
    }
}
