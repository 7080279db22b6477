package com.ryuqq.verhoeff.examples;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExampleSummary 테스트.
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
class ExampleSummaryTest {

    @Test
    void allAsExpected_NoUnexpected_ReturnsTrue() {
        assertTrue(new ExampleSummary(15, 0).allAsExpected());
        assertFalse(new ExampleSummary(15, 1).allAsExpected());
    }

    @Test
    void constructor_UnexpectedExceedsDemonstrations_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new ExampleSummary(2, 3)
        );
        assertTrue(exception.getMessage().contains("unexpected must be between 0 and 2"));
    }

    @Test
    void constructor_NegativeDemonstrations_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new ExampleSummary(-1, 0));
    }
}
