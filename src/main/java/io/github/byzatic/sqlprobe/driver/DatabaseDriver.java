package io.github.byzatic.sqlprobe.driver;

import io.github.byzatic.sqlprobe.model.DbSettings;
import org.jetbrains.annotations.NotNull;

/**
 * Runs one probe query. Implementations must release the connection whatever the outcome
 * and report failures through {@link QueryOutcome#getError()} instead of throwing.
 */
@FunctionalInterface
public interface DatabaseDriver {
    @NotNull QueryOutcome run(@NotNull DbSettings settings, @NotNull String query);
}
