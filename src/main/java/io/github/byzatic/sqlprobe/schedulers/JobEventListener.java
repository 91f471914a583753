package io.github.byzatic.sqlprobe.schedulers;

import io.github.byzatic.sqlprobe.classifier.Status;

import java.util.UUID;

/**
 * Job event listener. Callbacks run on scheduler threads and must not block.
 */
public interface JobEventListener {
    default void onStart(UUID jobId) {
    }

    default void onComplete(UUID jobId, Status status) {
    }

    /**
     * The trigger fired while the previous run of the job was still in flight.
     */
    default void onSkipped(UUID jobId) {
    }
}
