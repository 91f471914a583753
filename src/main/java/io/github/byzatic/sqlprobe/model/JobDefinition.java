package io.github.byzatic.sqlprobe.model;

import io.github.byzatic.sqlprobe.base_exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable definition of a probe job. Edits produce a new instance with the same id.
 */
public final class JobDefinition {
    private final UUID id;
    private final String name;
    private final String description;
    private final String query;
    private final int frequencySeconds;

    private JobDefinition(Builder b) {
        this.id = b.id;
        this.name = b.name;
        this.description = b.description;
        this.query = b.query;
        this.frequencySeconds = b.frequencySeconds;
    }

    public static Builder builder() {
        return new Builder();
    }

    public @NotNull UUID getId() {
        return id;
    }

    public @NotNull String getName() {
        return name;
    }

    public @NotNull String getDescription() {
        return description;
    }

    public @NotNull String getQuery() {
        return query;
    }

    public int getFrequencySeconds() {
        return frequencySeconds;
    }

    /**
     * Starts a builder prefilled with this definition, keeping the id.
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .query(query)
                .frequencySeconds(frequencySeconds);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobDefinition)) return false;
        JobDefinition that = (JobDefinition) o;
        return frequencySeconds == that.frequencySeconds
                && id.equals(that.id)
                && name.equals(that.name)
                && description.equals(that.description)
                && query.equals(that.query);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, description, query, frequencySeconds);
    }

    @Override
    public String toString() {
        return "JobDefinition{id=" + id + ", name='" + name + "', frequencySeconds=" + frequencySeconds + '}';
    }

    public static final class Builder {
        private UUID id;
        private String name;
        private String description = "";
        private String query;
        private int frequencySeconds = 1;

        /**
         * Optional. A fresh random id is assigned when not set.
         */
        public Builder id(@Nullable UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(@Nullable String description) {
            this.description = description == null ? "" : description;
            return this;
        }

        public Builder query(String query) {
            this.query = query;
            return this;
        }

        public Builder frequencySeconds(int frequencySeconds) {
            this.frequencySeconds = frequencySeconds;
            return this;
        }

        public JobDefinition build() throws ValidationException {
            if (name == null || name.trim().isEmpty()) {
                throw new ValidationException("Job name must not be empty");
            }
            if (query == null || query.trim().isEmpty()) {
                throw new ValidationException("Job '" + name + "' has an empty query");
            }
            if (frequencySeconds < 1) {
                throw new ValidationException("Job '" + name + "' frequency must be >= 1 second, got " + frequencySeconds);
            }
            if (id == null) id = UUID.randomUUID();
            return new JobDefinition(this);
        }
    }
}
