package com.ryuqq.verhoeff.core.id;

import com.ryuqq.verhoeff.core.digit.DigitParser;
import com.ryuqq.verhoeff.core.engine.ChecksumEngine;
import com.ryuqq.verhoeff.core.error.InvalidLength;
import com.ryuqq.verhoeff.core.outcome.Result;

/**
 * 고정 길이 ID 검증기 (예: 12자리 Aadhaar).
 *
 * <p><strong>처리 순서:</strong></p>
 * <ol>
 *   <li>길이 검사: 불일치 시 {@link InvalidLength}</li>
 *   <li>전체 문자 파싱: 파서 오류 그대로 전달</li>
 *   <li>페이로드(마지막 제외)의 체크 디지트를 계산해 마지막 자릿수와 비교</li>
 * </ol>
 *
 * <p>길이는 {@link CharSequence#length()} 기준(UTF-16 코드 유닛)으로 계산합니다.</p>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public final class FixedLengthIdValidator {

    private static final FixedLengthIdValidator AADHAAR = new FixedLengthIdValidator(new FixedLengthIdConfig());

    private final FixedLengthIdConfig config;
    private final ChecksumEngine engine;

    /**
     * 생성자 (공유 엔진 사용).
     *
     * @param config 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public FixedLengthIdValidator(FixedLengthIdConfig config) {
        this(config, ChecksumEngine.INSTANCE);
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param engine 체크섬 엔진
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public FixedLengthIdValidator(FixedLengthIdConfig config, ChecksumEngine engine) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        this.config = config;
        this.engine = engine;
    }

    /**
     * 12자리 Aadhaar 검증기.
     *
     * @return 기본 설정의 검증기
     */
    public static FixedLengthIdValidator aadhaar() {
        return AADHAAR;
    }

    /**
     * ID 검증.
     *
     * @param input 체크 디지트를 포함한 ID 문자열
     * @return 성공 시 체크 디지트 일치 여부, 실패 시 InvalidLength 또는 파서 오류
     * @throws IllegalArgumentException input이 null인 경우
     */
    public Result<Boolean> validate(CharSequence input) {
        if (input == null) {
            throw new IllegalArgumentException("input cannot be null");
        }
        if (input.length() != config.requiredLength()) {
            return Result.failure(new InvalidLength(config.name(), config.requiredLength(), input.length()));
        }
        return DigitParser.parse(input)
            .map(digits -> engine.checkDigitOf(digits.payload()) == digits.lastDigit());
    }

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    public FixedLengthIdConfig getConfig() {
        return config;
    }
}
