package com.ryuqq.verhoeff.core.digit;

import com.ryuqq.verhoeff.core.error.EmptyInput;
import com.ryuqq.verhoeff.core.error.InvalidCharacter;
import com.ryuqq.verhoeff.core.error.VerhoeffError;
import com.ryuqq.verhoeff.core.outcome.Failure;
import com.ryuqq.verhoeff.core.outcome.Result;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DigitParser 테스트.
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
class DigitParserTest {

    @Test
    void parse_Digits_PreservesOrderAndLength() {
        // When
        DigitSequence digits = DigitParser.parse("0123456789").orElseThrow();

        // Then
        assertEquals(10, digits.length());
        for (int i = 0; i < 10; i++) {
            assertEquals(i, digits.digitAt(i));
        }
    }

    @Test
    void parse_LeadingZeros_ArePreserved() {
        // When
        DigitSequence digits = DigitParser.parse("000").orElseThrow();

        // Then
        assertEquals(3, digits.length());
        assertEquals(0, digits.digitAt(0));
    }

    @Test
    void parse_EmptyInput_ReturnsEmptyInput() {
        // When
        Result<DigitSequence> result = DigitParser.parse("");

        // Then
        assertTrue(result.isFailure());
        assertInstanceOf(EmptyInput.class, ((Failure<DigitSequence>) result).error());
    }

    @Test
    void parse_Letter_ReturnsInvalidCharacterAtFirstOffendingPosition() {
        // When
        Result<DigitSequence> result = DigitParser.parse("12a4b");

        // Then
        VerhoeffError error = result.getError().orElseThrow();
        InvalidCharacter invalid = assertInstanceOf(InvalidCharacter.class, error);
        assertEquals(2, invalid.position());
        assertEquals("a", invalid.character());
    }

    @Test
    void parse_Whitespace_IsNotTrimmed() {
        assertTrue(DigitParser.parse(" 123").isFailure());
        assertTrue(DigitParser.parse("123 ").isFailure());
        assertTrue(DigitParser.parse("12 3").isFailure());
        assertTrue(DigitParser.parse("123\n").isFailure());
    }

    @Test
    void parse_Sign_IsRejected() {
        assertTrue(DigitParser.parse("-123").isFailure());
        assertTrue(DigitParser.parse("+123").isFailure());
    }

    @Test
    void parse_NonAsciiDigits_AreRejected() {
        // Arabic-Indic, Devanagari, fullwidth
        String[] inputs = {"١٢٣", "१२३", "１２３"};

        for (String input : inputs) {
            Result<DigitSequence> result = DigitParser.parse(input);
            InvalidCharacter invalid = assertInstanceOf(InvalidCharacter.class, result.getError().orElseThrow());
            assertEquals(0, invalid.position());
            assertEquals(input.codePointAt(0), invalid.codePoint());
        }
    }

    @Test
    void parse_SupplementaryCharacter_ReportsFullCodePoint() {
        // MATHEMATICAL BOLD DIGIT ONE (U+1D7CF)
        String input = "1" + new String(Character.toChars(0x1D7CF));

        // When
        Result<DigitSequence> result = DigitParser.parse(input);

        // Then
        InvalidCharacter invalid = assertInstanceOf(InvalidCharacter.class, result.getError().orElseThrow());
        assertEquals(1, invalid.position());
        assertEquals(0x1D7CF, invalid.codePoint());
    }

    @Test
    void parse_StringBuilderInput_IsAccepted() {
        assertTrue(DigitParser.parse(new StringBuilder("42")).isSuccess());
    }

    @Test
    void parse_NullInput_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> DigitParser.parse(null)
        );
        assertTrue(exception.getMessage().contains("input cannot be null"));
    }
}
