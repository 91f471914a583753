package io.github.byzatic.sqlprobe.model;

import io.github.byzatic.sqlprobe.base_exceptions.ValidationException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Connection credentials shared by all probes. Immutable; a settings change replaces the whole instance.
 */
public final class DbSettings {
    public static final int DEFAULT_PORT = 5432;

    private static final DbSettings EMPTY = new DbSettings("", DEFAULT_PORT, "", "", "");

    private final String host;
    private final int port;
    private final String dbname;
    private final String user;
    private final String password;

    private DbSettings(String host, int port, String dbname, String user, String password) {
        this.host = host;
        this.port = port;
        this.dbname = dbname;
        this.user = user;
        this.password = password;
    }

    /**
     * Settings used before anything was configured.
     */
    public static @NotNull DbSettings empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public @NotNull String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public @NotNull String getDbname() {
        return dbname;
    }

    public @NotNull String getUser() {
        return user;
    }

    public @NotNull String getPassword() {
        return password;
    }

    public Builder toBuilder() {
        return new Builder().host(host).port(port).dbname(dbname).user(user).password(password);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DbSettings)) return false;
        DbSettings that = (DbSettings) o;
        return port == that.port
                && host.equals(that.host)
                && dbname.equals(that.dbname)
                && user.equals(that.user)
                && password.equals(that.password);
    }

    @Override
    public int hashCode() {
        return Objects.hash(host, port, dbname, user, password);
    }

    @Override
    public String toString() {
        return "DbSettings{host='" + host + "', port=" + port + ", dbname='" + dbname + "', user='" + user + "', password=***}";
    }

    public static final class Builder {
        private String host = "";
        private int port = DEFAULT_PORT;
        private String dbname = "";
        private String user = "";
        private String password = "";

        public Builder host(@Nullable String host) {
            this.host = host == null ? "" : host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder dbname(@Nullable String dbname) {
            this.dbname = dbname == null ? "" : dbname;
            return this;
        }

        public Builder user(@Nullable String user) {
            this.user = user == null ? "" : user;
            return this;
        }

        public Builder password(@Nullable String password) {
            this.password = password == null ? "" : password;
            return this;
        }

        public DbSettings build() throws ValidationException {
            if (port < 1 || port > 65535) {
                throw new ValidationException("Port must be within 1..65535, got " + port);
            }
            return new DbSettings(host, port, dbname, user, password);
        }
    }
}
