package io.github.byzatic.sqlprobe.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import io.github.byzatic.sqlprobe.base_exceptions.PersistenceException;
import io.github.byzatic.sqlprobe.base_exceptions.ValidationException;
import io.github.byzatic.sqlprobe.model.DbSettings;
import org.jetbrains.annotations.NotNull;

import java.nio.file.Path;
import java.util.Optional;

/**
 * DB settings as a JSON object with keys {@code host, port, dbname, user, password}.
 */
public final class JsonDbSettingsRepository implements DbSettingsRepository {
    private static final TypeReference<SettingsDocument> DOCUMENT = new TypeReference<SettingsDocument>() {
    };

    private final VfsJsonFile file;

    private JsonDbSettingsRepository(VfsJsonFile file) {
        this.file = file;
    }

    public static JsonDbSettingsRepository forUri(@NotNull String uri) throws PersistenceException {
        return new JsonDbSettingsRepository(VfsJsonFile.resolve(uri));
    }

    public static JsonDbSettingsRepository forPath(@NotNull Path path) throws PersistenceException {
        return new JsonDbSettingsRepository(VfsJsonFile.resolve(path));
    }

    @Override
    public DbSettings load() throws PersistenceException {
        Optional<SettingsDocument> doc = file.read(DOCUMENT);
        if (doc.isEmpty()) return DbSettings.empty();
        SettingsDocument d = doc.get();
        try {
            return DbSettings.builder()
                    .host(d.host)
                    .port(d.port == null ? DbSettings.DEFAULT_PORT : d.port)
                    .dbname(d.dbname)
                    .user(d.user)
                    .password(d.password)
                    .build();
        } catch (ValidationException e) {
            throw new PersistenceException("Invalid settings in " + file.uri() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void save(DbSettings settings) throws PersistenceException {
        SettingsDocument d = new SettingsDocument();
        d.host = settings.getHost();
        d.port = settings.getPort();
        d.dbname = settings.getDbname();
        d.user = settings.getUser();
        d.password = settings.getPassword();
        file.write(d);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static final class SettingsDocument {
        public String host;
        public Integer port;
        public String dbname;
        public String user;
        public String password;
    }
}
