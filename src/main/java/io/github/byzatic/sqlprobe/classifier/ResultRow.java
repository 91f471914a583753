package io.github.byzatic.sqlprobe.classifier;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The single row fetched by a probe. Column values may be null.
 */
public final class ResultRow {
    private final List<Object> columns;

    public ResultRow(@NotNull List<?> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public static ResultRow of(Object... columns) {
        return new ResultRow(Arrays.asList(columns));
    }

    public int size() {
        return columns.size();
    }

    /**
     * First column value, or null if the row has no columns or the value is SQL NULL.
     */
    public @Nullable Object firstColumn() {
        return columns.isEmpty() ? null : columns.get(0);
    }

    public @NotNull List<Object> getColumns() {
        return columns;
    }

    @Override
    public String toString() {
        return "ResultRow" + columns;
    }
}
