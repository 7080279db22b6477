package com.ryuqq.verhoeff.examples;

import com.ryuqq.verhoeff.core.Verhoeff;
import com.ryuqq.verhoeff.core.outcome.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Verhoeff 공개 API 사용 예제.
 *
 * <p><strong>시연 항목:</strong></p>
 * <ol>
 *   <li>체크 디지트 계산</li>
 *   <li>체크 디지트 검증 (기대값과 비교)</li>
 *   <li>체크 디지트 덧붙이기</li>
 *   <li>Aadhaar 검증 (유효, 체크 디지트 불일치, 길이 오류)</li>
 *   <li>단일 자릿수 오류와 인접 전치 오류 검출</li>
 * </ol>
 *
 * <p>결과는 {@link ReportWriter}로 출력하며, 기대와 다른 결과의 개수를 {@link ExampleSummary}로 반환합니다.</p>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public final class ExampleRunner {

    private static final Logger log = LoggerFactory.getLogger(ExampleRunner.class);

    private static final List<String> CHECKSUM_INPUTS = List.of("12345", "987654321", "1111111111");
    private static final List<ExpectedValidation> VALIDATION_INPUTS = List.of(
        new ExpectedValidation("123451", true),
        new ExpectedValidation("123450", false),
        new ExpectedValidation("9876543217", true),
        new ExpectedValidation("9876543210", false)
    );
    private static final List<String> APPEND_INPUTS = List.of("12345678901", "98765432109", "55555555555");

    private final ReportWriter writer;

    private int demonstrations;
    private int unexpected;

    /**
     * 생성자.
     *
     * @param writer 출력 대상
     * @throws IllegalArgumentException writer가 null인 경우
     */
    public ExampleRunner(ReportWriter writer) {
        if (writer == null) {
            throw new IllegalArgumentException("writer cannot be null");
        }
        this.writer = writer;
    }

    /**
     * 모든 예제 실행.
     *
     * @return 실행 요약
     */
    public ExampleSummary run() {
        demonstrations = 0;
        unexpected = 0;

        calculateChecksums();
        validateNumbers();
        appendChecksums();
        validateAadhaar();
        demonstrateErrorDetection();

        ExampleSummary summary = new ExampleSummary(demonstrations, unexpected);
        log.info("Examples completed: {} demonstrations, {} unexpected", summary.demonstrations(), summary.unexpected());
        return summary;
    }

    private void calculateChecksums() {
        writer.section("1. Calculating Checksum:");
        for (String number : CHECKSUM_INPUTS) {
            writer.line(number + " -> checksum: " + Verhoeff.computeChecksum(number));
            demonstrations++;
        }
    }

    private void validateNumbers() {
        writer.section("2. Validating Numbers:");
        for (ExpectedValidation input : VALIDATION_INPUTS) {
            boolean valid = Verhoeff.validate(input.number());
            writer.line(input.number() + " -> " + (valid ? "Valid" : "Invalid")
                + " (expected: " + (input.valid() ? "valid" : "invalid") + ")");
            tally(valid == input.valid());
        }
    }

    private void appendChecksums() {
        writer.section("3. Appending Checksums:");
        for (String id : APPEND_INPUTS) {
            String withChecksum = Verhoeff.appendChecksum(id);
            writer.line(id + " -> " + withChecksum);
            tally(Verhoeff.validate(withChecksum));
        }
    }

    private void validateAadhaar() {
        writer.section("4. Aadhaar Validation:");

        String validAadhaar = Verhoeff.appendChecksum("12345678901");
        writer.line("Testing valid Aadhaar: " + validAadhaar);
        Result<Boolean> valid = Verhoeff.validateAadhaar(validAadhaar);
        writer.line(describe(valid));
        tally(valid.getOrElse(Boolean.FALSE));

        String invalidAadhaar = "123456789019";
        writer.line("Testing invalid Aadhaar: " + invalidAadhaar);
        Result<Boolean> invalid = Verhoeff.validateAadhaar(invalidAadhaar);
        writer.line(describe(invalid));
        tally(invalid.isSuccess() && !invalid.orElseThrow());

        String wrongLength = "12345";
        writer.line("Testing wrong length: " + wrongLength);
        Result<Boolean> lengthError = Verhoeff.validateAadhaar(wrongLength);
        writer.line(describe(lengthError));
        tally(lengthError.isFailure());
    }

    private void demonstrateErrorDetection() {
        writer.section("5. Error Detection Demo:");

        String complete = Verhoeff.appendChecksum("12345");
        writer.line("Original: " + complete);

        char[] substituted = complete.toCharArray();
        substituted[2] = '9';
        String withError = new String(substituted);
        writer.line("Single digit error: " + complete + " -> " + withError);
        reportDetection(withError);

        char[] swapped = complete.toCharArray();
        char tmp = swapped[1];
        swapped[1] = swapped[2];
        swapped[2] = tmp;
        String withTransposition = new String(swapped);
        writer.line("Transposition error: " + complete + " -> " + withTransposition);
        reportDetection(withTransposition);
    }

    private void reportDetection(String corrupted) {
        boolean detected = !Verhoeff.validate(corrupted);
        writer.line("Detection: " + (detected ? "Error detected" : "Failed to detect"));
        tally(detected);
    }

    private static String describe(Result<Boolean> result) {
        return result.getError()
            .map(error -> {
                log.debug("Aadhaar validation rejected input: {} {}", error.errorCode(), error.message());
                return "Error: " + error.message();
            })
            .orElseGet(() -> result.orElseThrow() ? "Valid Aadhaar number" : "Invalid checksum");
    }

    private void tally(boolean asExpected) {
        demonstrations++;
        if (!asExpected) {
            unexpected++;
        }
    }

    private record ExpectedValidation(String number, boolean valid) {
    }
}
