package com.ryuqq.verhoeff.core.engine;

import com.ryuqq.verhoeff.core.digit.DigitParser;
import com.ryuqq.verhoeff.core.error.EmptyInput;
import com.ryuqq.verhoeff.core.error.InvalidCharacter;
import com.ryuqq.verhoeff.core.outcome.Result;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ChecksumEngine 테스트.
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
class ChecksumEngineTest {

    private final ChecksumEngine engine = new ChecksumEngine();

    @Test
    @DisplayName("알려진 입력의 체크 디지트")
    void compute_KnownVectors_ReturnExpectedCheckDigit() {
        assertThat(engine.compute("236").orElseThrow()).isEqualTo(3);
        assertThat(engine.compute("12345").orElseThrow()).isEqualTo(1);
        assertThat(engine.compute("142857").orElseThrow()).isEqualTo(0);
        assertThat(engine.compute("12345678901").orElseThrow()).isEqualTo(0);
        assertThat(engine.compute("987654321").orElseThrow()).isEqualTo(7);
        assertThat(engine.compute("123456789").orElseThrow()).isEqualTo(0);
    }

    @Test
    void compute_SingleDigitPayloads() {
        assertThat(engine.compute("0").orElseThrow()).isEqualTo(4);
        assertThat(engine.compute("1").orElseThrow()).isEqualTo(5);
        assertThat(engine.compute("9").orElseThrow()).isEqualTo(1);
    }

    @Test
    void compute_LeadingZerosChangeResult() {
        // 앞자리 0도 위치를 차지하므로 결과에 영향
        assertThat(engine.compute("00000000000").orElseThrow()).isEqualTo(3);
        assertThat(engine.compute("0").orElseThrow()).isNotEqualTo(3);
    }

    @Test
    void validate_KnownVectors() {
        assertThat(engine.validate("2363").orElseThrow()).isTrue();
        assertThat(engine.validate("123451").orElseThrow()).isTrue();
        assertThat(engine.validate("1428570").orElseThrow()).isTrue();
        assertThat(engine.validate("9876543217").orElseThrow()).isTrue();

        assertThat(engine.validate("2364").orElseThrow()).isFalse();
        assertThat(engine.validate("123450").orElseThrow()).isFalse();
        assertThat(engine.validate("1428571").orElseThrow()).isFalse();
        assertThat(engine.validate("9876543210").orElseThrow()).isFalse();
    }

    @Test
    void validate_SingleDigit_OnlyZeroIsValid() {
        // 위치 0은 항등 순열이므로 c = D[0][d] = d
        assertThat(engine.validate("0").orElseThrow()).isTrue();
        for (int d = 1; d < 10; d++) {
            assertThat(engine.validate(String.valueOf(d)).orElseThrow()).isFalse();
        }
    }

    @Test
    void compute_EmptyInput_ReturnsEmptyInput() {
        Result<Integer> result = engine.compute("");

        assertThat(result.getError()).containsInstanceOf(EmptyInput.class);
    }

    @Test
    void validate_EmptyInput_ReturnsEmptyInput() {
        Result<Boolean> result = engine.validate("");

        assertThat(result.getError()).containsInstanceOf(EmptyInput.class);
    }

    @Test
    void compute_InvalidCharacter_PropagatesParserError() {
        // When
        Result<Integer> result = engine.compute("12a45");

        // Then
        assertThat(result.getError()).hasValueSatisfying(error -> {
            assertThat(error).isInstanceOf(InvalidCharacter.class);
            assertThat(((InvalidCharacter) error).character()).isEqualTo("a");
        });
    }

    @Test
    void validate_InvalidCharacter_PropagatesParserError() {
        Result<Boolean> result = engine.validate("12345a");

        assertThat(result.getError()).containsInstanceOf(InvalidCharacter.class);
    }

    @Test
    void checkDigitOf_MatchesCompute() {
        assertThat(engine.checkDigitOf(DigitParser.parse("236").orElseThrow())).isEqualTo(3);
    }

    @Test
    void isValid_ParsedSequence() {
        assertThat(engine.isValid(DigitParser.parse("2363").orElseThrow())).isTrue();
        assertThat(engine.isValid(DigitParser.parse("2364").orElseThrow())).isFalse();
    }

    @Test
    void compute_ThenValidate_RoundTripsAcrossPermutationCycle() {
        // 길이 1~24: 순열 주기(8)를 여러 번 지나는 경우 포함
        StringBuilder payload = new StringBuilder();
        for (int length = 1; length <= 24; length++) {
            payload.append((length * 7) % 10);
            int check = engine.compute(payload).orElseThrow();
            assertThat(engine.validate(payload.toString() + check).orElseThrow())
                .as("payload %s with check %d", payload, check)
                .isTrue();
        }
    }

    @Test
    void compute_IsDeterministic() {
        String input = "31415926535897932384626433";

        assertThat(engine.compute(input)).isEqualTo(engine.compute(input));
        assertThat(new ChecksumEngine().compute(input)).isEqualTo(ChecksumEngine.INSTANCE.compute(input));
    }

    @Test
    void compute_VeryLongInput() {
        String input = "1234567890".repeat(1000);

        int check = engine.compute(input).orElseThrow();

        assertThat(engine.validate(input + check).orElseThrow()).isTrue();
    }
}
