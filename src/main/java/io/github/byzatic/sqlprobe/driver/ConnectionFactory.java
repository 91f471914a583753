package io.github.byzatic.sqlprobe.driver;

import io.github.byzatic.sqlprobe.model.DbSettings;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens a fresh JDBC connection for one probe run. The caller closes it.
 */
@FunctionalInterface
public interface ConnectionFactory {
    Connection open(DbSettings settings) throws SQLException;
}
