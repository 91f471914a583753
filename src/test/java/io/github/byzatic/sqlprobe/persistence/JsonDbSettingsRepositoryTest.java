package io.github.byzatic.sqlprobe.persistence;

import io.github.byzatic.sqlprobe.base_exceptions.PersistenceException;
import io.github.byzatic.sqlprobe.model.DbSettings;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonDbSettingsRepositoryTest {

    @TempDir
    Path dir;

    @Test
    void missingFile_loadsDefaults() throws Exception {
        assertEquals(DbSettings.empty(), JsonDbSettingsRepository.forPath(dir.resolve("settings.json")).load());
    }

    @Test
    void saveThenLoad() throws Exception {
        DbSettings s = DbSettings.builder().host("db.internal").port(6432).dbname("billing").user("probe").password("pw").build();
        Path file = dir.resolve("settings.json");
        JsonDbSettingsRepository.forPath(file).save(s);

        assertEquals(s, JsonDbSettingsRepository.forPath(file).load());
        assertTrue(Files.readString(file).contains("\"dbname\""));
    }

    @Test
    void portAsString_isAccepted() throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{\"host\": \"h\", \"port\": \"5433\", \"dbname\": \"d\", \"user\": \"u\", \"password\": \"p\"}");
        assertEquals(5433, JsonDbSettingsRepository.forPath(file).load().getPort());
    }

    @Test
    void missingPort_defaultsTo5432() throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{\"host\": \"h\"}");
        DbSettings s = JsonDbSettingsRepository.forPath(file).load();
        assertEquals(5432, s.getPort());
        assertEquals("", s.getUser());
    }

    @Test
    void invalidPort_isPersistenceException() throws Exception {
        Path file = dir.resolve("settings.json");
        Files.writeString(file, "{\"port\": 0}");
        assertThrows(PersistenceException.class, () -> JsonDbSettingsRepository.forPath(file).load());
    }
}
