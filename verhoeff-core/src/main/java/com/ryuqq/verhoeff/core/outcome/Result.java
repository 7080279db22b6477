package com.ryuqq.verhoeff.core.outcome;

import com.ryuqq.verhoeff.core.error.VerhoeffError;

import java.util.Optional;
import java.util.function.Function;

/**
 * 엄격(strict) API의 실행 결과.
 *
 * <p>Result는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Success}: 값이 계산됨</li>
 *   <li>{@link Failure}: 입력이 잘못되어 {@link VerhoeffError}가 발생함</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 경우 외의 구현을 허용하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Result&lt;Integer&gt; result = Verhoeff.computeChecksumStrict("12345");
 * if (result instanceof Failure&lt;Integer&gt; failure) {
 *     System.out.println("Failed: " + failure.error().message());
 * }
 * </pre>
 *
 * @param <T> 성공 값 타입
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public sealed interface Result<T> permits Success, Failure {

    /**
     * 성공 결과 생성.
     *
     * @param value 성공 값
     * @param <T> 성공 값 타입
     * @return Success 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    /**
     * 실패 결과 생성.
     *
     * @param error 오류
     * @param <T> 성공 값 타입
     * @return Failure 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T> Result<T> failure(VerhoeffError error) {
        return new Failure<>(error);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailure() {
        return this instanceof Failure;
    }

    /**
     * 성공 값 또는 기본값 조회.
     *
     * @param other 실패 시 반환할 값
     * @return 성공 값 또는 other
     */
    T getOrElse(T other);

    /**
     * 성공 값을 변환.
     *
     * <p>실패인 경우 동일한 오류를 그대로 전달합니다.</p>
     *
     * @param mapper 변환 함수
     * @param <U> 변환 후 타입
     * @return 변환된 Result
     */
    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    /**
     * 성공 값으로 다음 Result를 계산.
     *
     * @param mapper Result를 반환하는 함수
     * @param <U> 변환 후 타입
     * @return mapper의 결과 또는 동일한 오류의 Failure
     */
    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    /**
     * 성공 값 조회, 실패 시 예외.
     *
     * @return 성공 값
     * @throws com.ryuqq.verhoeff.core.error.VerhoeffException 실패인 경우
     */
    T orElseThrow();

    /**
     * 오류 조회.
     *
     * @return 실패인 경우 오류, 성공인 경우 빈 Optional
     */
    Optional<VerhoeffError> getError();
}
