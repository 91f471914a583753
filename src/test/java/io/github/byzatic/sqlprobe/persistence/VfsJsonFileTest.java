package io.github.byzatic.sqlprobe.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import io.github.byzatic.sqlprobe.base_exceptions.PersistenceException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VfsJsonFileTest {

    @TempDir
    Path dir;

    public static final class Exploding {
        public String getName() {
            return "first";
        }

        public String getQuery() {
            throw new IllegalStateException("serializer broke");
        }
    }

    @Test
    void failedWrite_keepsPreviousContent_andLeavesNoTempFile() throws Exception {
        Path target = dir.resolve("jobs.json");
        VfsJsonFile file = VfsJsonFile.resolve(target);
        file.write(Arrays.asList(Map.of("name", "ping")));
        String before = Files.readString(target);

        assertThrows(PersistenceException.class, () -> file.write(Arrays.asList(new Exploding())));

        assertEquals(before, Files.readString(target));
        assertFalse(Files.exists(dir.resolve("jobs.json" + VfsJsonFile.TMP_SUFFIX)));
        List<Map<String, Object>> read = file.read(new TypeReference<List<Map<String, Object>>>() {
        }).orElseThrow();
        assertEquals("ping", read.get(0).get("name"));
    }

    @Test
    void write_replacesExistingFile() throws Exception {
        Path target = dir.resolve("settings.json");
        VfsJsonFile file = VfsJsonFile.resolve(target);
        file.write(Map.of("host", "a"));
        file.write(Map.of("host", "b"));

        Map<String, Object> read = file.read(new TypeReference<Map<String, Object>>() {
        }).orElseThrow();
        assertEquals("b", read.get("host"));
        assertFalse(Files.exists(dir.resolve("settings.json" + VfsJsonFile.TMP_SUFFIX)));
    }
}
