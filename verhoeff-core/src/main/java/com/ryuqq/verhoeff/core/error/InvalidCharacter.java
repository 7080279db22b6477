package com.ryuqq.verhoeff.core.error;

/**
 * 숫자가 아닌 문자가 포함된 입력.
 *
 * <p>ASCII 범위 밖의 숫자 문자(아라비아-인도 숫자, 전각 숫자 등)도 이 오류로 거부됩니다.</p>
 *
 * @param position 첫 번째 잘못된 문자의 위치 (0부터 시작, UTF-16 인덱스)
 * @param codePoint 잘못된 문자의 코드 포인트
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public record InvalidCharacter(int position, int codePoint) implements VerhoeffError {

    /**
     * 오류 코드.
     */
    public static final String ERROR_CODE = "VERHOEFF-001";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException position이 음수이거나 codePoint가 유효하지 않은 경우
     */
    public InvalidCharacter {
        if (position < 0) {
            throw new IllegalArgumentException("position must be non-negative (current: " + position + ")");
        }
        if (!Character.isValidCodePoint(codePoint)) {
            throw new IllegalArgumentException("codePoint is not a valid code point (current: " + codePoint + ")");
        }
    }

    /**
     * 잘못된 문자를 문자열로 조회.
     *
     * @return 잘못된 문자
     */
    public String character() {
        return new String(Character.toChars(codePoint));
    }

    @Override
    public String errorCode() {
        return ERROR_CODE;
    }

    @Override
    public String message() {
        return "Invalid character '" + character() + "' at position " + position + " - only digits allowed";
    }
}
