package io.github.byzatic.sqlprobe.classifier;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Classification of the latest probe result. Only {@link Kind#ERROR} carries a message.
 */
public final class Status {

    public enum Kind {UNKNOWN, HEALTHY, UNHEALTHY, INDETERMINATE, ERROR}

    public static final Status UNKNOWN = new Status(Kind.UNKNOWN, "");
    public static final Status HEALTHY = new Status(Kind.HEALTHY, "");
    public static final Status UNHEALTHY = new Status(Kind.UNHEALTHY, "");
    public static final Status INDETERMINATE = new Status(Kind.INDETERMINATE, "");

    private final Kind kind;
    private final String message;

    private Status(Kind kind, String message) {
        this.kind = kind;
        this.message = message;
    }

    public static @NotNull Status error(@NotNull String message) {
        if (message.isEmpty()) throw new IllegalArgumentException("error message must not be empty");
        return new Status(Kind.ERROR, message);
    }

    public @NotNull Kind getKind() {
        return kind;
    }

    /**
     * Error message, empty for every kind except {@link Kind#ERROR}.
     */
    public @NotNull String getMessage() {
        return message;
    }

    public boolean isError() {
        return kind == Kind.ERROR;
    }

    /**
     * Short label for status tables.
     */
    public @NotNull String displayText() {
        switch (kind) {
            case HEALTHY:
                return "True";
            case UNHEALTHY:
                return "False";
            case INDETERMINATE:
                return "Other";
            case ERROR:
                return "Error: " + message;
            default:
                return "Unknown";
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Status)) return false;
        Status status = (Status) o;
        return kind == status.kind && message.equals(status.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message);
    }

    @Override
    public String toString() {
        return kind == Kind.ERROR ? "ERROR(" + message + ")" : kind.name();
    }
}
