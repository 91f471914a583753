package io.github.byzatic.sqlprobe.driver;

import io.github.byzatic.sqlprobe.base_exceptions.ProbeException;
import io.github.byzatic.sqlprobe.classifier.ResultRow;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.Optional;

/**
 * Raw result of a driver call: at most one row, or an error.
 */
public final class QueryOutcome {
    private static final QueryOutcome NO_ROWS = new QueryOutcome(null, null);

    private final ResultRow row;
    private final ProbeException error;

    private QueryOutcome(@Nullable ResultRow row, @Nullable ProbeException error) {
        this.row = row;
        this.error = error;
    }

    public static QueryOutcome row(@NotNull ResultRow row) {
        return new QueryOutcome(Objects.requireNonNull(row), null);
    }

    public static QueryOutcome noRows() {
        return NO_ROWS;
    }

    public static QueryOutcome failure(@NotNull ProbeException error) {
        return new QueryOutcome(null, Objects.requireNonNull(error));
    }

    public Optional<ResultRow> getRow() {
        return Optional.ofNullable(row);
    }

    public Optional<ProbeException> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return error != null ? "QueryOutcome{error=" + error + '}' : "QueryOutcome{row=" + row + '}';
    }
}
