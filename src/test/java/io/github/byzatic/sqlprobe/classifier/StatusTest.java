package io.github.byzatic.sqlprobe.classifier;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StatusTest {

    @Test
    void displayText_matchesStatusTable() {
        assertEquals("Unknown", Status.UNKNOWN.displayText());
        assertEquals("True", Status.HEALTHY.displayText());
        assertEquals("False", Status.UNHEALTHY.displayText());
        assertEquals("Other", Status.INDETERMINATE.displayText());
        assertEquals("Error: connection refused", Status.error("connection refused").displayText());
    }

    @Test
    void errorsWithSameMessage_areEqual() {
        assertEquals(Status.error("x"), Status.error("x"));
        assertNotEquals(Status.error("x"), Status.error("y"));
    }

    @Test
    void emptyErrorMessage_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> Status.error(""));
    }
}
