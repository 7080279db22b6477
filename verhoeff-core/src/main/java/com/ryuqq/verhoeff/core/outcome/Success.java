package com.ryuqq.verhoeff.core.outcome;

import com.ryuqq.verhoeff.core.error.VerhoeffError;

import java.util.Optional;
import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value 계산된 값 (null 불가)
 * @param <T> 값 타입
 *
 * @author Verhoeff Team
 * @since 1.0.0
 */
public record Success<T>(T value) implements Result<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException value가 null인 경우
     */
    public Success {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    @Override
    public T getOrElse(T other) {
        return value;
    }

    @Override
    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        return new Success<>(mapper.apply(value));
    }

    @Override
    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        return mapper.apply(value);
    }

    @Override
    public T orElseThrow() {
        return value;
    }

    @Override
    public Optional<VerhoeffError> getError() {
        return Optional.empty();
    }
}
