package io.github.byzatic.sqlprobe.driver;

import io.github.byzatic.sqlprobe.model.DbSettings;
import org.jetbrains.annotations.NotNull;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Properties;

/**
 * PostgreSQL connections through {@link DriverManager}, one per call, no pooling.
 */
public final class DriverManagerConnectionFactory implements ConnectionFactory {
    private final Duration connectTimeout; // null = driver default

    public DriverManagerConnectionFactory() {
        this(null);
    }

    public DriverManagerConnectionFactory(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    @Override
    public Connection open(DbSettings settings) throws SQLException {
        Properties props = new Properties();
        props.setProperty("user", settings.getUser());
        props.setProperty("password", settings.getPassword());
        if (connectTimeout != null) {
            // pgjdbc expects whole seconds
            props.setProperty("connectTimeout", String.valueOf(Math.max(1, connectTimeout.toSeconds())));
        }
        return DriverManager.getConnection(jdbcUrl(settings), props);
    }

    static @NotNull String jdbcUrl(@NotNull DbSettings settings) {
        return "jdbc:postgresql://" + settings.getHost() + ":" + settings.getPort() + "/" + settings.getDbname();
    }
}
