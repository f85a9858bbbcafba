package com.ryuqq.halfling.core.result;

import com.ryuqq.halfling.core.function.CheckedFunction;

import java.util.function.Function;

/**
 * 실패 결과.
 *
 * @param error 실패 정보 (non-null)
 * @param <T> 값 타입 (실패에는 값이 없으므로 자유롭게 재지정 가능)
 *
 * @author Halfling Team
 * @since 1.0.0
 */
public record Failure<T>(ErrorInfo error) implements Result<T> {

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
    public boolean isSuccess() {
        return false;
    }

    @Override
    public <R> R fold(Function<? super T, ? extends R> onSuccess, Function<? super ErrorInfo, ? extends R> onFailure) {
        return onFailure.apply(error);
    }

    @Override
    public T orElseThrow() {
        throw new TaskFailedException(error);
    }

    @Override
    public <U> Result<U> map(CheckedFunction<? super T, ? extends U> f) {
        return retype();
    }

    @Override
    public <U> Result<U> bind(CheckedFunction<? super T, ? extends Result<U>> f) {
        return retype();
    }

    @Override
    public Result<T> recover(CheckedFunction<? super ErrorInfo, ?> f) {
        if (f == null) {
            throw new IllegalArgumentException("f cannot be null");
        }
        return Result.join(Result.attempt(() -> f.apply(error)));
    }

    /**
     * 값 타입만 바꾼 동일한 Failure.
     *
     * @param <U> 새 값 타입
     * @return 같은 error를 담은 Failure
     */
    public <U> Failure<U> retype() {
        return new Failure<>(error);
    }

    @Override
    public String toString() {
        return "Failure{" + error.message() + '}';
    }
}
