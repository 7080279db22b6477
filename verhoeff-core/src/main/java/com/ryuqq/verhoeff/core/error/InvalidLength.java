package com.ryuqq.verhoeff.core.error;

/**
 * 고정 길이 ID의 길이 불일치.
 *
 * <p>길이 검사는 문자 검사와 체크섬 비교보다 먼저 수행되므로,
 * 길이가 틀린 입력은 체크섬 비교 단계에 도달하지 않습니다.</p>
 *
 * @param idName ID 체계 이름 (예: Aadhaar)
 * @param expected 요구되는 길이
 * @param actual 실제 입력 길이
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public record InvalidLength(String idName, int expected, int actual) implements VerhoeffError {

    /**
     * 오류 코드.
     */
    public static final String ERROR_CODE = "VERHOEFF-003";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException idName이 비어 있거나 길이 값이 유효하지 않은 경우
     */
    public InvalidLength {
        if (idName == null || idName.isBlank()) {
            throw new IllegalArgumentException("idName cannot be null or blank");
        }
        if (expected <= 0) {
            throw new IllegalArgumentException("expected must be positive (current: " + expected + ")");
        }
        if (actual < 0) {
            throw new IllegalArgumentException("actual must be non-negative (current: " + actual + ")");
        }
    }

    @Override
    public String errorCode() {
        return ERROR_CODE;
    }

    @Override
    public String message() {
        return idName + " numbers must be " + expected + " digits, got " + actual + " digits";
    }
}
