package com.ryuqq.verhoeff.core.digit;

import com.ryuqq.verhoeff.core.error.EmptyInput;
import com.ryuqq.verhoeff.core.error.InvalidCharacter;
import com.ryuqq.verhoeff.core.outcome.Result;

/**
 * 문자 시퀀스를 {@link DigitSequence}로 변환.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>빈 입력: {@link EmptyInput}</li>
 *   <li>ASCII '0'~'9'가 아닌 첫 번째 문자: {@link InvalidCharacter}</li>
 *   <li>공백 제거, 부호 처리, 앞자리 0 정규화 없음</li>
 * </ul>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public final class DigitParser {

    private DigitParser() {
        throw new AssertionError("Cannot instantiate utility class");
    }

    /**
     * 입력 파싱.
     *
     * @param input 문자 시퀀스
     * @return 성공 시 DigitSequence, 실패 시 EmptyInput 또는 InvalidCharacter
     * @throws IllegalArgumentException input이 null인 경우
     */
    public static Result<DigitSequence> parse(CharSequence input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (input.length() == 0) {
            return Result.failure(new EmptyInput());
        }

        byte[] digits = new byte[input.length()];
        for (int i = 0; i < digits.length; i++) {
            char ch = input.charAt(i);
            // Character.isDigit()는 다른 문자 체계의 숫자도 허용하므로 사용하지 않음
            if (ch < '0' || ch > '9') {
                return Result.failure(new InvalidCharacter(i, Character.codePointAt(input, i)));
            }
            digits[i] = (byte) (ch - '0');
        }
        return Result.success(new DigitSequence(digits));
    }
}
