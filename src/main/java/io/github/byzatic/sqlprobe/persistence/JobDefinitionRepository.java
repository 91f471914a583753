package io.github.byzatic.sqlprobe.persistence;

import io.github.byzatic.sqlprobe.base_exceptions.PersistenceException;
import io.github.byzatic.sqlprobe.model.JobDefinition;

import java.util.List;

/**
 * Durable, ordered storage of job definitions.
 */
public interface JobDefinitionRepository {
    /**
     * @return stored definitions in display order, empty if nothing was saved yet
     */
    List<JobDefinition> load() throws PersistenceException;

    void save(List<JobDefinition> definitions) throws PersistenceException;
}
