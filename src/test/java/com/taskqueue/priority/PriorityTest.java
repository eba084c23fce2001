package com.taskqueue.priority;

import com.taskqueue.exception.InvalidPriorityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Priority.
 */
class PriorityTest {

    @ParameterizedTest
    @CsvSource({
            "1, HIGH",
            "2, MEDIUM",
            "3, LOW"
    })
    @DisplayName("Should resolve each fixed level")
    void shouldResolveLevels(int level, Priority expected) {
        assertEquals(expected, Priority.of(level));
        assertEquals(level, expected.level());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 4, -3, 100})
    @DisplayName("Should reject levels outside the fixed set")
    void shouldRejectUnknownLevels(int level) {
        InvalidPriorityException ex = assertThrows(InvalidPriorityException.class, () -> Priority.of(level));
        assertEquals(Integer.valueOf(level), ex.getLevel());
        assertTrue(ex.getMessage().contains(String.valueOf(level)));
    }

    @Test
    @DisplayName("Declaration order matches urgency")
    void declarationOrderMatchesUrgency() {
        Priority[] values = Priority.values();
        for (int i = 1; i < values.length; i++) {
            assertTrue(values[i - 1].level() < values[i].level());
        }
    }
}
