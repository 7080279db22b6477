package com.ryuqq.verhoeff.core.error;

/**
 * {@link VerhoeffError}를 예외로 전달하기 위한 unchecked 예외.
 *
 * <p>라이브러리 자체는 잘못된 입력에 대해 예외를 던지지 않습니다.
 * 호출자가 {@code Result.orElseThrow()}를 선택한 경우에만 사용됩니다.</p>
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public class VerhoeffException extends RuntimeException {

    private final VerhoeffError error;

    /**
     * 생성자.
     *
     * @param error 원인 오류
     * @throws IllegalArgumentException error가 null인 경우
     */
    public VerhoeffException(VerhoeffError error) {
        super(requireError(error).errorCode() + ": " + error.message());
        this.error = error;
    }

    /**
     * 원인 오류 조회.
     *
     * @return 원인 오류
     */
    public VerhoeffError getError() {
        return error;
    }

    private static VerhoeffError requireError(VerhoeffError error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return error;
    }
}
