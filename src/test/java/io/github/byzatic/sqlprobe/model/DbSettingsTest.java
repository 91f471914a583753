package io.github.byzatic.sqlprobe.model;

import io.github.byzatic.sqlprobe.base_exceptions.ValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DbSettingsTest {

    @Test
    void empty_usesDefaultPort() {
        assertEquals(5432, DbSettings.empty().getPort());
        assertEquals("", DbSettings.empty().getHost());
    }

    @Test
    void toString_hidesPassword() throws Exception {
        DbSettings s = DbSettings.builder().host("db").user("monitor").password("s3cret").build();
        assertFalse(s.toString().contains("s3cret"));
    }

    @Test
    void portOutOfRange_isRejected() {
        assertThrows(ValidationException.class, () -> DbSettings.builder().port(0).build());
        assertThrows(ValidationException.class, () -> DbSettings.builder().port(70000).build());
    }
}
