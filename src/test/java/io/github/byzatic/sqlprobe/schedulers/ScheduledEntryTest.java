package io.github.byzatic.sqlprobe.schedulers;

import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScheduledEntryTest {

    @Test
    void earlierDueTime_comesFirst() {
        long now = System.nanoTime();
        ScheduledEntry later = new ScheduledEntry(UUID.randomUUID(), now + TimeUnit.SECONDS.toNanos(2));
        ScheduledEntry sooner = new ScheduledEntry(UUID.randomUUID(), now + TimeUnit.SECONDS.toNanos(1));
        assertTrue(sooner.compareTo(later) < 0);
        assertTrue(later.compareTo(sooner) > 0);
    }

    @Test
    void sameDueTime_keepsArmingOrder() throws Exception {
        long due = System.nanoTime() - 1;
        ScheduledEntry first = new ScheduledEntry(UUID.randomUUID(), due);
        ScheduledEntry second = new ScheduledEntry(UUID.randomUUID(), due);

        DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
        queue.offer(second);
        queue.offer(first);

        assertSame(first, queue.take());
        assertSame(second, queue.take());
    }

    @Test
    void delay_countsDownToDueTime() {
        ScheduledEntry entry = new ScheduledEntry(UUID.randomUUID(), System.nanoTime() + TimeUnit.SECONDS.toNanos(5));
        long delay = entry.getDelay(TimeUnit.MILLISECONDS);
        assertTrue(delay > 4000 && delay <= 5000, "delay " + delay);

        ScheduledEntry due = new ScheduledEntry(UUID.randomUUID(), System.nanoTime() - 1);
        assertTrue(due.getDelay(TimeUnit.NANOSECONDS) <= 0);
    }

    @Test
    void removal_isByIdentity() {
        UUID id = UUID.randomUUID();
        long due = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        ScheduledEntry cancelled = new ScheduledEntry(id, due);
        ScheduledEntry rearmed = new ScheduledEntry(id, due);

        DelayQueue<ScheduledEntry> queue = new DelayQueue<>();
        queue.offer(cancelled);
        queue.offer(rearmed);
        assertTrue(queue.remove(cancelled));

        assertEquals(1, queue.size());
        assertSame(rearmed, queue.peek());
    }
}
