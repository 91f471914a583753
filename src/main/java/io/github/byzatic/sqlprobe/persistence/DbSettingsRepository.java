package io.github.byzatic.sqlprobe.persistence;

import io.github.byzatic.sqlprobe.base_exceptions.PersistenceException;
import io.github.byzatic.sqlprobe.model.DbSettings;

public interface DbSettingsRepository {
    /**
     * @return stored settings, or {@link DbSettings#empty()} if nothing was saved yet
     */
    DbSettings load() throws PersistenceException;

    void save(DbSettings settings) throws PersistenceException;
}
