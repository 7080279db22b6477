package com.ryuqq.verhoeff.core.id;

/**
 * 고정 길이 ID 검증 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: ID 체계 이름, 오류 메시지에 사용 (기본 "Aadhaar")</li>
 *   <li>requiredLength: 체크 디지트를 포함한 길이 (기본 12)</li>
 * </ul>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 * @param name ID 체계 이름 (비어 있으면 안 됨)
 * @param requiredLength 요구 길이 (2 이상, 페이로드 1자리 + 체크 디지트)
 */
public record FixedLengthIdConfig(String name, int requiredLength) {

    /**
     * Aadhaar 기본 길이.
     */
    public static final int AADHAAR_LENGTH = 12;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: name="Aadhaar", requiredLength=12</p>
     */
    public FixedLengthIdConfig() {
        this("Aadhaar", AADHAAR_LENGTH);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FixedLengthIdConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (requiredLength < 2) {
            throw new IllegalArgumentException(
                "requiredLength must be >= 2 (current: " + requiredLength + ")"
            );
        }
    }

    /**
     * name만 변경한 새 인스턴스 생성.
     *
     * @param name 새로운 이름
     * @return 새 FixedLengthIdConfig 인스턴스
     */
    public FixedLengthIdConfig withName(String name) {
        return new FixedLengthIdConfig(name, this.requiredLength);
    }

    /**
     * requiredLength만 변경한 새 인스턴스 생성.
     *
     * @param requiredLength 새로운 요구 길이
     * @return 새 FixedLengthIdConfig 인스턴스
     */
    public FixedLengthIdConfig withRequiredLength(int requiredLength) {
        return new FixedLengthIdConfig(this.name, requiredLength);
    }
}
