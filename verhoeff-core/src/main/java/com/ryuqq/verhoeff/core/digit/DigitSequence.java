package com.ryuqq.verhoeff.core.digit;

import java.util.Arrays;

/**
 * 0~9 범위 자릿수의 불변 시퀀스.
 *
 * <p>{@link DigitParser}를 통해서만 생성되며, 입력 문자열과 길이 및 순서가 1:1로 대응합니다.
 * 앞자리 0도 그대로 보존됩니다.</p>
 *
 * <p><strong>불변성:</strong> 내부 배열은 외부로 노출되지 않습니다.</p>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public final class DigitSequence {

    private final byte[] digits;

    DigitSequence(byte[] digits) {
        if (digits == null || digits.length == 0) {
            throw new IllegalArgumentException("digits cannot be null or empty");
        }
        this.digits = digits;
    }

    /**
     * 자릿수 개수.
     *
     * @return 길이 (1 이상)
     */
    public int length() {
        return digits.length;
    }

    /**
     * 앞에서부터 index 위치의 자릿수.
     *
     * @param index 0부터 시작하는 위치
     * @return 자릿수 (0~9)
     * @throws IndexOutOfBoundsException index가 범위를 벗어난 경우
     */
    public int digitAt(int index) {
        return digits[index];
    }

    /**
     * 끝에서부터 distance만큼 떨어진 자릿수.
     *
     * <p>distance=0은 마지막 자릿수입니다.</p>
     *
     * @param distance 끝에서부터의 거리
     * @return 자릿수 (0~9)
     * @throws IndexOutOfBoundsException distance가 범위를 벗어난 경우
     */
    public int digitFromEnd(int distance) {
        return digits[digits.length - 1 - distance];
    }

    /**
     * 마지막 자릿수 (체크 디지트 위치).
     *
     * @return 마지막 자릿수
     */
    public int lastDigit() {
        return digits[digits.length - 1];
    }

    /**
     * 마지막 자릿수를 제외한 시퀀스.
     *
     * @return 페이로드 시퀀스
     * @throws IllegalStateException 길이가 2 미만인 경우
     */
    public DigitSequence payload() {
        if (digits.length < 2) {
            throw new IllegalStateException("payload requires at least 2 digits (current: " + digits.length + ")");
        }
        return new DigitSequence(Arrays.copyOf(digits, digits.length - 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DigitSequence that = (DigitSequence) o;
        return Arrays.equals(digits, that.digits);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(digits);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(digits.length);
        for (byte digit : digits) {
            sb.append((char) ('0' + digit));
        }
        return "DigitSequence{" + sb + '}';
    }
}
