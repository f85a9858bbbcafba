package com.ryuqq.halfling.core.result;

import com.ryuqq.halfling.core.function.CheckedFunction;

import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param value 성공 값 (null 가능)
 * @param <T> 값 타입
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public record Success<T>(T value) implements Result<T> {

    @Override
    public boolean isSuccess() {
        return true;
    }

    @Override
    public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super ErrorInfo, ? extends R> onFailure) {
        return onSuccess.apply(value);
    }

    @Override
    public T orElseThrow() {
        return value;
    }

    @Override
    public <U> Result<U> map(CheckedFunction<? super T, ? extends U> f) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        return Result.attempt(() -> f.apply(value));
    }

    @Override
    public <U> Result<U> bind(CheckedFunction<? super T, ? extends Result<U>> f) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        return Result.join(Result.attempt(() -> f.apply(value)));
    }

    @Override
    public Result<T> recover(CheckedFunction<? super ErrorInfo, ?> f) {
        return this;
    }

    @Override
    public String toString() {
        return "Success{" + value + '}';
    }
}
