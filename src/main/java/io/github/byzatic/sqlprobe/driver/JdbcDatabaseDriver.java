package io.github.byzatic.sqlprobe.driver;

import com.google.common.annotations.Beta;
import com.google.errorprone.annotations.ThreadSafe;
import io.github.byzatic.sqlprobe.base_exceptions.ConnectionException;
import io.github.byzatic.sqlprobe.base_exceptions.QueryException;
import io.github.byzatic.sqlprobe.classifier.ResultRow;
import io.github.byzatic.sqlprobe.model.DbSettings;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC implementation of {@link DatabaseDriver}.
 * - One connection per call, closed on every path (try-with-resources).
 * - Fetches at most one row.
 * - Failures while opening the connection, and SQLState class {@code 08} errors, are connection errors;
 *   everything else is a query error.
 * - Optional query timeout, off by default.
 */
@ThreadSafe
public final class JdbcDatabaseDriver implements DatabaseDriver {
    private final static Logger logger = LoggerFactory.getLogger(JdbcDatabaseDriver.class);

    private final ConnectionFactory connectionFactory;
    private final Duration queryTimeout;

    private JdbcDatabaseDriver(ConnectionFactory connectionFactory, Duration queryTimeout) {
        this.connectionFactory = connectionFactory;
        this.queryTimeout = queryTimeout;
    }

    public static final class Builder {
        private ConnectionFactory connectionFactory;
        private Duration connectTimeout;
        private Duration queryTimeout;

        /**
         * Custom connection source. When set, {@link #connectTimeout(Duration)} is ignored.
         */
        public Builder connectionFactory(ConnectionFactory connectionFactory) {
            this.connectionFactory = Objects.requireNonNull(connectionFactory);
            return this;
        }

        @Beta
        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = requirePositive(connectTimeout);
            return this;
        }

        /**
         * Upper bound for a single probe query. A probe is never interrupted otherwise.
         */
        @Beta
        public Builder queryTimeout(Duration queryTimeout) {
            this.queryTimeout = requirePositive(queryTimeout);
            return this;
        }

        public JdbcDatabaseDriver build() {
            ConnectionFactory factory = connectionFactory != null
                    ? connectionFactory
                    : new DriverManagerConnectionFactory(connectTimeout);
            return new JdbcDatabaseDriver(factory, queryTimeout);
        }

        private static Duration requirePositive(Duration d) {
            Objects.requireNonNull(d);
            if (d.isNegative() || d.isZero()) throw new IllegalArgumentException("timeout must be > 0");
            return d;
        }
    }

    @Override
    public @NotNull QueryOutcome run(@NotNull DbSettings settings, @NotNull String query) {
        Connection connection;
        try {
            connection = connectionFactory.open(settings);
        } catch (SQLException | RuntimeException e) {
            logger.debug("Cannot connect to {}:{}/{}: {}", settings.getHost(), settings.getPort(), settings.getDbname(), e.toString());
            return QueryOutcome.failure(new ConnectionException(messageOf(e), e));
        }

        try (Connection conn = connection;
             Statement st = conn.createStatement()) {
            st.setMaxRows(1);
            if (queryTimeout != null) {
                st.setQueryTimeout((int) Math.max(1, queryTimeout.toSeconds()));
            }
            try (ResultSet rs = st.executeQuery(query)) {
                if (!rs.next()) return QueryOutcome.noRows();
                int count = rs.getMetaData().getColumnCount();
                List<Object> columns = new ArrayList<>(count);
                for (int i = 1; i <= count; i++) {
                    columns.add(rs.getObject(i));
                }
                return QueryOutcome.row(new ResultRow(columns));
            }
        } catch (SQLException e) {
            logger.debug("Probe query failed: {}", e.toString());
            if (isConnectionState(e)) {
                return QueryOutcome.failure(new ConnectionException(messageOf(e), e));
            }
            return QueryOutcome.failure(new QueryException(messageOf(e), e));
        } catch (RuntimeException e) {
            logger.debug("Probe query failed unexpectedly", e);
            return QueryOutcome.failure(new QueryException(messageOf(e), e));
        }
    }

    private static boolean isConnectionState(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }

    private static String messageOf(Exception e) {
        String message = e.getMessage();
        return message == null || message.trim().isEmpty() ? e.getClass().getName() : message.trim();
    }
}
