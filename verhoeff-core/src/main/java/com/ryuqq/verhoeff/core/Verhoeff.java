package com.ryuqq.verhoeff.core;

import com.ryuqq.verhoeff.core.engine.ChecksumEngine;
import com.ryuqq.verhoeff.core.id.FixedLengthIdConfig;
import com.ryuqq.verhoeff.core.id.FixedLengthIdValidator;
import com.ryuqq.verhoeff.core.outcome.Result;

/**
 * Verhoeff 체크 디지트 공개 API.
 *
 * <p>두 가지 형태의 API를 함께 제공합니다:</p>
 * <ul>
 *   <li><strong>Strict:</strong> {@link Result}를 반환하며 오류 정보를 보존합니다.
 *       오류를 구분해야 하는 곳에서는 반드시 이 API를 사용하십시오.</li>
 *   <li><strong>Permissive:</strong> 일반 값을 반환하며 모든 오류를 고정된 기본값으로 바꿉니다
 *       (0 / false / 입력 그대로). 오류 정보는 사라집니다.</li>
 * </ul>
 *
 * <p><strong>주의:</strong> {@link #computeChecksum(CharSequence)}가 반환하는 0은
 * 실제 체크 디지트 0과 구분할 수 없습니다. 실패 여부를 알아야 한다면
 * {@link #computeChecksumStrict(CharSequence)}를 사용하십시오.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Verhoeff.computeChecksum("236");        // 3
 * Verhoeff.validate("2363");              // true
 * Verhoeff.appendChecksum("12345");       // "123451"
 * Verhoeff.validateAadhaar("12345");      // Failure(InvalidLength)
 * </pre>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public final class Verhoeff {

    private static final ChecksumEngine ENGINE = ChecksumEngine.INSTANCE;

    private Verhoeff() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * 체크 디지트 계산 (permissive).
     *
     * <p><strong>손실 변환:</strong> 빈 입력이나 숫자가 아닌 문자가 있으면 0을 반환합니다.
     * 이 값은 정상적인 체크 디지트 0과 구분되지 않습니다.</p>
     *
     * @param input 페이로드 자릿수 문자열
     * @return 체크 디지트 (0~9), 오류 시 0
     * @throws IllegalArgumentException input이 null인 경우
     */
    public static int computeChecksum(CharSequence input) {
        return computeChecksumStrict(input).getOrElse(0);
    }

    /**
     * 체크 디지트 계산 (strict).
     *
     * @param input 페이로드 자릿수 문자열
     * @return 체크 디지트 또는 EmptyInput/InvalidCharacter
     * @throws IllegalArgumentException input이 null인 경우
     */
    public static Result<Integer> computeChecksumStrict(CharSequence input) {
        return ENGINE.compute(input);
    }

    /**
     * 체크 디지트를 포함한 시퀀스 검증 (permissive).
     *
     * <p><strong>손실 변환:</strong> 빈 입력이나 잘못된 문자는 false로 처리됩니다.</p>
     *
     * @param input 체크 디지트가 포함된 자릿수 문자열
     * @return 유효하면 true, 무효이거나 오류 시 false
     * @throws IllegalArgumentException input이 null인 경우
     */
    public static boolean validate(CharSequence input) {
        return validateStrict(input).getOrElse(Boolean.FALSE);
    }

    /**
     * 체크 디지트를 포함한 시퀀스 검증 (strict).
     *
     * @param input 체크 디지트가 포함된 자릿수 문자열
     * @return 유효 여부 또는 EmptyInput/InvalidCharacter
     * @throws IllegalArgumentException input이 null인 경우
     */
    public static Result<Boolean> validateStrict(CharSequence input) {
        return ENGINE.validate(input);
    }

    /**
     * 체크 디지트를 덧붙인 문자열 생성.
     *
     * <p><strong>손실 변환:</strong> 입력이 잘못된 경우 아무 표시 없이 입력을 그대로 반환합니다.
     * 오류를 감지하려면 {@link #computeChecksumStrict(CharSequence)}를 사용하십시오.</p>
     *
     * @param input 페이로드 자릿수 문자열
     * @return input + 체크 디지트, 오류 시 input 그대로
     * @throws IllegalArgumentException input이 null인 경우
     */
    public static String appendChecksum(CharSequence input) {
        String value = checkNotNull(input).toString();
        return computeChecksumStrict(input)
            .map(checkDigit -> value + checkDigit)
            .getOrElse(value);
    }

    /**
     * 12자리 고정 길이 ID 검증.
     *
     * @param input ID 문자열
     * @return 체크 디지트 일치 여부 또는 InvalidLength/EmptyInput/InvalidCharacter
     * @throws IllegalArgumentException input이 null인 경우
     */
    public static Result<Boolean> validateFixedLengthId(CharSequence input) {
        return validateFixedLengthId(input, FixedLengthIdConfig.AADHAAR_LENGTH);
    }

    /**
     * 임의 길이의 고정 길이 ID 검증.
     *
     * @param input ID 문자열
     * @param requiredLength 체크 디지트를 포함한 요구 길이 (2 이상)
     * @return 체크 디지트 일치 여부 또는 InvalidLength/EmptyInput/InvalidCharacter
     * @throws IllegalArgumentException input이 null이거나 requiredLength가 2 미만인 경우
     */
    public static Result<Boolean> validateFixedLengthId(CharSequence input, int requiredLength) {
        FixedLengthIdConfig config = new FixedLengthIdConfig("ID", requiredLength);
        return new FixedLengthIdValidator(config, ENGINE).validate(input);
    }

    /**
     * Aadhaar 번호 검증.
     *
     * @param input 12자리 Aadhaar 번호
     * @return 체크 디지트 일치 여부 또는 InvalidLength/EmptyInput/InvalidCharacter
     * @throws IllegalArgumentException input이 null인 경우
     */
    public static Result<Boolean> validateAadhaar(CharSequence input) {
        return FixedLengthIdValidator.aadhaar().validate(input);
    }

    private static CharSequence checkNotNull(CharSequence input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        return input;
    }
}
