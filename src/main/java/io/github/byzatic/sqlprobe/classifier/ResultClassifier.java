package io.github.byzatic.sqlprobe.classifier;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * Maps a raw probe result to a {@link Status}.
 * <p>
 * Rules, in order:
 * <ul>
 *   <li>an error always wins and yields {@code ERROR(message)};</li>
 *   <li>no row, no columns or a NULL first column yields {@code INDETERMINATE};</li>
 *   <li>{@code Boolean.TRUE} / {@code Boolean.FALSE} yield {@code HEALTHY} / {@code UNHEALTHY};</li>
 *   <li>anything else (numbers, text, ...) yields {@code INDETERMINATE}.</li>
 * </ul>
 * Stateless and thread-safe.
 */
public final class ResultClassifier {

    public @NotNull Status classify(@Nullable ResultRow row, @Nullable Throwable error) {
        if (error != null) {
            return Status.error(describe(error));
        }
        Object first = row == null ? null : row.firstColumn();
        if (Boolean.TRUE.equals(first)) return Status.HEALTHY;
        if (Boolean.FALSE.equals(first)) return Status.UNHEALTHY;
        return Status.INDETERMINATE;
    }

    /**
     * Non-empty text for an error: its message, or the exception type when there is none.
     */
    static @NotNull String describe(@NotNull Throwable error) {
        String message = error.getMessage();
        if (message == null || message.trim().isEmpty()) {
            return error.getClass().getName();
        }
        return message.trim();
    }
}
