package io.github.byzatic.sqlprobe.schedulers;

import java.util.UUID;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One pending trigger of a job, due at a point on the {@link System#nanoTime()} timeline so that wall-clock
 * adjustments never move a schedule. Equality is identity, so a cancelled entry can be removed from the queue.
 * Entries due at the same instant leave the queue in the order they were armed.
 */
final class ScheduledEntry implements Delayed {
    private static final AtomicLong SEQUENCE = new AtomicLong();

    final UUID jobId;
    final long dueAtNanos;
    private final long sequence = SEQUENCE.getAndIncrement();

    ScheduledEntry(UUID jobId, long dueAtNanos) {
        this.jobId = jobId;
        this.dueAtNanos = dueAtNanos;
    }

    @Override
    public long getDelay(TimeUnit unit) {
        return unit.convert(dueAtNanos - System.nanoTime(), TimeUnit.NANOSECONDS);
    }

    @Override
    public int compareTo(Delayed o) {
        ScheduledEntry other = (ScheduledEntry) o;
        // nanoTime values are only comparable by difference
        long diff = dueAtNanos - other.dueAtNanos;
        if (diff != 0) return diff < 0 ? -1 : 1;
        return Long.compare(sequence, other.sequence);
    }
}
