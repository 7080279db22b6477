package com.ryuqq.verhoeff.core.error;

/**
 * 입력 파싱 및 검증 오류.
 *
 * <p>VerhoeffError는 세 가지 경우를 나타냅니다:</p>
 * <ul>
 *   <li>{@link InvalidCharacter}: ASCII 숫자('0'~'9')가 아닌 문자 포함</li>
 *   <li>{@link EmptyInput}: 빈 입력</li>
 *   <li>{@link InvalidLength}: 고정 길이 ID의 길이 불일치</li>
 * </ul>
 *
 * <p>오류는 예외가 아닌 값으로 반환되며, 파서에서 발생한 오류는
 * 엔진과 고정 길이 검증기를 거쳐도 감싸거나 변환하지 않고 그대로 전달됩니다.</p>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public sealed interface VerhoeffError permits InvalidCharacter, EmptyInput, InvalidLength {

    /**
     * 오류 코드 조회 (예: VERHOEFF-001).
     *
     * @return 오류 코드
     */
    String errorCode();

    /**
     * 사람이 읽을 수 있는 오류 메시지.
     *
     * @return 오류 메시지
     */
    String message();
}
