package com.ryuqq.verhoeff.core.outcome;

import com.ryuqq.verhoeff.core.error.VerhoeffError;
import com.ryuqq.verhoeff.core.error.VerhoeffException;

import java.util.Optional;
import java.util.function.Function;

/**
 * 실패 결과.
 *
 * <p>map/flatMap을 거쳐도 동일한 {@link VerhoeffError} 인스턴스가 유지됩니다.</p>
 *
 * @param error 오류 (null 불가)
 * @param <T> 성공 값 타입
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public record Failure<T>(VerhoeffError error) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null인 경우
     */
    public Failure {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }

    @Override
    public T getOrElse(T other) {
        return other;
    }

    @Override
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        return new Failure<>(error);
    }

    @Override
    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        return new Failure<>(error);
    }

    @Override
    public T orElseThrow() {
        throw new VerhoeffException(error);
    }

    @Override
    public Optional<VerhoeffError> getError() {
        return Optional.of(error);
    }
}
